package fr.imt.stackpilot.stackpilot.business.port;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentEvent;
import fr.imt.stackpilot.stackpilot.business.model.DeploymentSummary;

import java.util.List;

public interface NotificationPort {
    void send(List<String> urls, DeploymentEvent event, DeploymentSummary summary);
}
