package postlogin.core.model.session;

/**
 * Command for starting a post-login session for an externally authenticated user.
 *
 * @param cif Customer identification number
 * @param customer Basic customer information
 * @param tokenKey Token issued by the external authority
 * @param channelId Channel the user logged in through
 * @param correlationId Request id for tracing
 */
public record SessionInitiation(
        String cif, CustomerProfile customer, String tokenKey, String channelId, String correlationId) {}
