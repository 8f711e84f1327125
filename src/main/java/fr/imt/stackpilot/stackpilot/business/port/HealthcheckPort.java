package fr.imt.stackpilot.stackpilot.business.port;

public interface HealthcheckPort {

    /**
     * @return the HTTP status returned by {@code url}, or {@code -1} when unreachable
     */
    int statusOf(String url);
}
