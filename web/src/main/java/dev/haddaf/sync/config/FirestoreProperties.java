package dev.haddaf.sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "firestore")
public class FirestoreProperties {

    /**
     * Flag indicating whether Firestore integration is enabled. When disabled the application runs on an
     * in-memory document store.
     */
    private boolean enabled;

    /**
     * Path or resource descriptor to the service account credentials file.
     */
    private String credentials;

    /**
     * Optional Google Cloud project identifier.
     */
    private String projectId;

    /**
     * Optional Firestore database id; the default database is used when empty.
     */
    private String databaseId;

    /**
     * Optional host:port of the Firestore emulator.
     */
    private String emulatorHost;

    /**
     * Collection holding one profile document per user, keyed by uid.
     */
    private String usersCollection = "users";

    /**
     * Collection holding notification records.
     */
    private String notificationsCollection = "notifications";

    /**
     * Collection holding team invitations.
     */
    private String invitationsCollection = "invitations";

    /**
     * Collection holding teams and their {@code players} sub-collections.
     */
    private String teamsCollection = "teams";

    /**
     * Collection holding uploaded video posts.
     */
    private String postsCollection = "videoPosts";

    /**
     * Collection holding monthly challenges and their {@code submissions} sub-collections.
     */
    private String challengesCollection = "challenges";

    /**
     * Collection holding coach verification requests.
     */
    private String coachRequestsCollection = "coachRequests";

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

    public String getDatabaseId() {
        return databaseId;
    }

    public void setDatabaseId(String databaseId) {
        this.databaseId = databaseId;
    }

    public String getEmulatorHost() {
        return emulatorHost;
    }

    public void setEmulatorHost(String emulatorHost) {
        this.emulatorHost = emulatorHost;
    }

    public String getUsersCollection() {
        return usersCollection;
    }

    public void setUsersCollection(String usersCollection) {
        this.usersCollection = usersCollection;
    }

    public String getNotificationsCollection() {
        return notificationsCollection;
    }

    public void setNotificationsCollection(String notificationsCollection) {
        this.notificationsCollection = notificationsCollection;
    }

    public String getInvitationsCollection() {
        return invitationsCollection;
    }

    public void setInvitationsCollection(String invitationsCollection) {
        this.invitationsCollection = invitationsCollection;
    }

    public String getTeamsCollection() {
        return teamsCollection;
    }

    public void setTeamsCollection(String teamsCollection) {
        this.teamsCollection = teamsCollection;
    }

    public String getPostsCollection() {
        return postsCollection;
    }

    public void setPostsCollection(String postsCollection) {
        this.postsCollection = postsCollection;
    }

    public String getChallengesCollection() {
        return challengesCollection;
    }

    public void setChallengesCollection(String challengesCollection) {
        this.challengesCollection = challengesCollection;
    }

    public String getCoachRequestsCollection() {
        return coachRequestsCollection;
    }

    public void setCoachRequestsCollection(String coachRequestsCollection) {
        this.coachRequestsCollection = coachRequestsCollection;
    }
}
