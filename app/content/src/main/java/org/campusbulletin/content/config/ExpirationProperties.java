/*
 * Where: content configuration binding
 * What: Holds the event grace period and the zone used to resolve calendar days
 * Why: Expiry windows are tunable per deployment
 */
package org.campusbulletin.content.config;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "content.expiration")
public record ExpirationProperties(
    @DefaultValue("7d") Duration eventGracePeriod, @DefaultValue("UTC") ZoneId zone) {}
