package postlogin.adapter.out.channel;

import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import postlogin.core.config.ChannelConfig;
import postlogin.core.model.session.ChannelSetting;
import postlogin.core.port.out.ChannelSettingRepository;

/**
 * Channel settings backed by {@code postlogin.channel.business-units.*} configuration.
 */
@ApplicationScoped
public class ConfigChannelSettingRepository implements ChannelSettingRepository {

    private static final Logger LOG = Logger.getLogger(ConfigChannelSettingRepository.class);

    private final Map<String, String> businessUnits;

    @Inject
    public ConfigChannelSettingRepository(ChannelConfig config) {
        this(config.businessUnits());
    }

    public ConfigChannelSettingRepository(Map<String, String> businessUnits) {
        this.businessUnits = Map.copyOf(businessUnits);
        LOG.debugf("Loaded %d channel settings", this.businessUnits.size());
    }

    @Override
    public Uni<Optional<ChannelSetting>> findById(String channelId) {
        if (channelId == null || !businessUnits.containsKey(channelId)) {
            return Uni.createFrom().item(Optional.empty());
        }
        return Uni.createFrom().item(Optional.of(new ChannelSetting(channelId, businessUnits.get(channelId))));
    }
}
