package fr.imt.stackpilot.stackpilot.business.port;

import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Project;

import java.util.List;
import java.util.Optional;

public interface ProjectRepositoryPort {
    Optional<Project> findByName(String name);
    List<Project> findAll();
    Project save(Project project);
}
