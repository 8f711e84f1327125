package fr.imt.stackpilot.stackpilot.infrastructure.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "projects")
public class Project {

    @Id
    private String name;

    private String description;

    // host hint (github, gitlab, default) -> token
    @Builder.Default
    private Map<String, String> tokens = new HashMap<>();

    @Builder.Default
    private List<String> successNotifications = new ArrayList<>();

    @Builder.Default
    private List<String> failureNotifications = new ArrayList<>();

    private Instant createdAt;

    private Instant updatedAt;

}
