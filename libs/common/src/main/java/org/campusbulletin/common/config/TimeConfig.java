/*
 * Where: shared configuration
 * What: Exposes the injectable Clock
 * Why: Every "now" and "today" in the services is read from one replaceable source
 */
package org.campusbulletin.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${app.time.zone:UTC}") String zone) {
    return Clock.system(ZoneId.of(zone));
  }
}
