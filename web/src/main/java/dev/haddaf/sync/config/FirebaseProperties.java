package dev.haddaf.sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "firebase")
public class FirebaseProperties {

    /**
     * Flag indicating whether ID tokens are verified with Firebase Authentication. When disabled, sign-in
     * accepts a raw uid, which is meant for local development only.
     */
    private boolean enabled;

    /**
     * Path or resource descriptor to the Firebase service account credentials file.
     */
    private String credentials;

    /**
     * Optional Firebase project identifier.
     */
    private String projectId;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCredentials() {
        return credentials;
    }

    public void setCredentials(String credentials) {
        this.credentials = credentials;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }
}
