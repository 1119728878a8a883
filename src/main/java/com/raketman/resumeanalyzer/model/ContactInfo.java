package com.raketman.resumeanalyzer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContactInfo {

    String fullName;
    String email;
    String phone;
    String location;

    public static ContactInfo empty() {
        return ContactInfo.builder().build();
    }

    public boolean hasEmail() {
        return email != null;
    }

    public boolean hasPhone() {
        return phone != null;
    }
}
