package fr.imt.stackpilot.stackpilot.infrastructure.persistence.repository;

import fr.imt.stackpilot.stackpilot.business.port.ProjectRepositoryPort;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Project;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoProjectRepositoryAdapter implements ProjectRepositoryPort {

    private final ProjectRepository projectRepository;

    @Override
    public Optional<Project> findByName(String name) {
        return projectRepository.findById(name);
    }

    @Override
    public List<Project> findAll() {
        return projectRepository.findAll();
    }

    @Override
    public Project save(Project project) {
        return projectRepository.save(project);
    }
}
