package fr.imt.stackpilot.stackpilot.presentation.web.dto.mappers;

import fr.imt.stackpilot.stackpilot.business.model.RepositoryState;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;
import fr.imt.stackpilot.stackpilot.presentation.web.dto.DeploymentResponse;
import fr.imt.stackpilot.stackpilot.presentation.web.dto.RepositoryStateResponse;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper(componentModel = "spring")
public interface DeploymentMapper {

    DeploymentResponse toResponse(Deployment deployment);

    List<DeploymentResponse> toResponses(List<Deployment> deployments);

    RepositoryStateResponse toResponse(RepositoryState state);
}
