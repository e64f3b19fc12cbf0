package space.ketterling.airsense.api;

/**
 * Derives the rate-limit identity of a caller.
 */
final class ClientIds {
    private ClientIds() {
    }

    /**
     * First address in {@code X-Forwarded-For} when behind a proxy, else the peer address.
     */
    static String resolve(String forwardedFor, String remoteIp) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty())
                return first;
        }
        return (remoteIp == null || remoteIp.isBlank()) ? "unknown" : remoteIp;
    }
}
