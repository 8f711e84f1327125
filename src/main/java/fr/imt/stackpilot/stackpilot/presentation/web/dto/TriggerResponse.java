package fr.imt.stackpilot.stackpilot.presentation.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TriggerResponse {
    private String repositoryId;
    private String result;
}
