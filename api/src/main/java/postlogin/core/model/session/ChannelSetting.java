package postlogin.core.model.session;

import java.util.Optional;

/**
 * Settings of a login channel.
 *
 * @param id Channel identifier
 * @param postLoginBu Business unit that owns post-login sessions of this channel (may be null)
 */
public record ChannelSetting(String id, String postLoginBu) {

    public Optional<String> businessUnit() {
        return postLoginBu == null || postLoginBu.isBlank() ? Optional.empty() : Optional.of(postLoginBu);
    }
}
