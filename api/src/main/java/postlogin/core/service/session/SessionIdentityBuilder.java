package postlogin.core.service.session;

import java.util.Locale;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import postlogin.core.config.SessionConfig;

/**
 * Derives the internal session handle from business unit and customer id.
 *
 * <p>Handle format: {@code <prefix>-<BU>-<customerId>}, e.g. {@code VPB-SME-12345}.
 * The business unit is upper-cased; both parts are trimmed. Neither part may contain
 * the {@code -} separator, so a handle always splits back into exactly three parts.
 */
@ApplicationScoped
public class SessionIdentityBuilder {

    private static final Pattern BUSINESS_UNIT = Pattern.compile("[A-Za-z0-9_]+");
    private static final Pattern CUSTOMER_ID = Pattern.compile("[A-Za-z0-9_.]+");

    private final String prefix;

    @Inject
    public SessionIdentityBuilder(SessionConfig config) {
        this(config.handlePrefix());
    }

    SessionIdentityBuilder(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Builds the session handle.
     *
     * @param businessUnit Business unit resolved from the channel
     * @param customerId Customer identification number
     * @return The handle
     * @throws InvalidIdentityException if either part is blank or contains disallowed characters
     */
    public String buildHandle(String businessUnit, String customerId) {
        String bu = normalize(businessUnit, "Business unit").toUpperCase(Locale.ROOT);
        String cif = normalize(customerId, "Customer id");

        if (!BUSINESS_UNIT.matcher(bu).matches()) {
            throw new InvalidIdentityException("Business unit contains invalid characters");
        }
        if (!CUSTOMER_ID.matcher(cif).matches()) {
            throw new InvalidIdentityException("Customer id contains invalid characters");
        }

        return prefix + "-" + bu + "-" + cif;
    }

    private static String normalize(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidIdentityException(name + " is required");
        }
        return value.trim();
    }

    /**
     * Exception thrown when a handle cannot be built from the given parts.
     */
    public static class InvalidIdentityException extends IllegalArgumentException {
        public InvalidIdentityException(String message) {
            super(message);
        }
    }
}
