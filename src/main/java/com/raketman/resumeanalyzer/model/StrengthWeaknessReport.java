package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StrengthWeaknessReport {

    List<Strength> strengths;
    List<Weakness> weaknesses;
}
