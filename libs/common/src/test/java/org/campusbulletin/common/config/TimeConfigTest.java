package org.campusbulletin.common.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class TimeConfigTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TimeConfig.class);

  @Test
  void clockDefaultsToUtc() {
    contextRunner.run(
        context -> assertThat(context.getBean(Clock.class).getZone()).isEqualTo(ZoneId.of("UTC")));
  }

  @Test
  void clockUsesConfiguredZone() {
    contextRunner
        .withPropertyValues("app.time.zone=Asia/Tokyo")
        .run(
            context ->
                assertThat(context.getBean(Clock.class).getZone())
                    .isEqualTo(ZoneId.of("Asia/Tokyo")));
  }
}
