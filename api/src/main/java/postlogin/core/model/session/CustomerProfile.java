package postlogin.core.model.session;

/**
 * Basic customer information supplied by the channel at session initiation.
 *
 * <p>All fields are optional; the session never derives identity from them.
 *
 * @param customerId channel-side customer identifier
 * @param customerName display name of the customer
 * @param customerType customer segment (e.g. SME, RETAIL)
 */
public record CustomerProfile(String customerId, String customerName, String customerType) {

    public static CustomerProfile empty() {
        return new CustomerProfile(null, null, null);
    }
}
