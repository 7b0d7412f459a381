package postlogin.core.config;

import java.util.Map;

import io.smallrye.config.ConfigMapping;

/**
 * Channel to business unit mapping.
 *
 * <p>Configuration prefix: {@code postlogin.channel}
 *
 * <pre>
 * postlogin.channel.business-units.sme=SME
 * postlogin.channel.business-units.retail=RETAIL
 * </pre>
 */
@ConfigMapping(prefix = "postlogin.channel")
public interface ChannelConfig {

    /**
     * Business unit per channel id.
     */
    Map<String, String> businessUnits();
}
