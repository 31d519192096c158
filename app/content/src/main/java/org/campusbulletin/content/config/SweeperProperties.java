/*
 * Where: content configuration binding
 * What: Holds cleanup sweeper switches and its interval
 * Why: Tests and local runs disable the timer without touching code
 */
package org.campusbulletin.content.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "content.sweeper")
public record SweeperProperties(boolean enabled, boolean runOnStartup, Duration interval) {}
