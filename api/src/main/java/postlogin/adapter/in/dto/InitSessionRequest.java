package postlogin.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * DTO for session initiation requests.
 *
 * <pre>{@code
 * {
 *   "data": {
 *     "cif": "1234567890",
 *     "basicCustomerInfo": { "customerId": "CUST123", "customerName": "John Doe", "customerType": "SME" },
 *     "tokenKey": "valid_token_key_123",
 *     "payload": { "channelId": "sme" }
 *   }
 * }
 * }</pre>
 *
 * <p>Snake case field names are accepted as aliases.
 *
 * @param data request envelope
 */
public record InitSessionRequest(Data data) {

    /**
     * @param cif customer identification number (required)
     * @param basicCustomerInfo basic customer information (required, fields optional)
     * @param tokenKey token issued by the external authority (required)
     * @param payload channel context (required)
     */
    public record Data(
            String cif,
            @JsonAlias("basic_customer_info") BasicCustomerInfo basicCustomerInfo,
            @JsonAlias("token_key") String tokenKey,
            Payload payload) {}

    public record BasicCustomerInfo(
            @JsonAlias("customer_id") String customerId,
            @JsonAlias("customer_name") String customerName,
            @JsonAlias("customer_type") String customerType) {}

    public record Payload(@JsonAlias("channel_id") String channelId) {}
}
