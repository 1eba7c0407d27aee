package space.ketterling.weatherpredict.archive;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Login for the remote archive. Only archive clients read it.
 */
public record ArchiveCredentials(String username, String password) {

    public static ArchiveCredentials none() {
        return new ArchiveCredentials("", "");
    }

    public boolean isPresent() {
        return username != null && !username.isBlank();
    }

    /**
     * HTTP Basic authorization header value.
     */
    public String basicAuthHeader() {
        String pass = password == null ? "" : password;
        String raw = username + ":" + pass;
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "ArchiveCredentials[username=" + username + ", password=***]";
    }
}
