package postlogin.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import postlogin.core.model.session.ChannelSetting;

/**
 * Outbound port for looking up login channel settings.
 */
public interface ChannelSettingRepository {

    /**
     * Find a channel by ID.
     *
     * @param channelId Channel identifier
     * @return The channel settings, or empty if the channel is unknown
     */
    Uni<Optional<ChannelSetting>> findById(String channelId);
}
