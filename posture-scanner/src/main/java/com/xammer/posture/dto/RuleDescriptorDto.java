package com.xammer.posture.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleDescriptorDto {
    private String service;
    private String check;
    private String ruleId;
    private String severity;
    private String inspects;
    private String whenMissing;
}
