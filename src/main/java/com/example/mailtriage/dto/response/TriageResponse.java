package com.example.mailtriage.dto.response;

import com.example.mailtriage.dto.response.triage.TriageOutput;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TriageResponse {
    private TriageOutput output;
}
