/*
 * Where: content cleanup worker
 * What: Runs the cleanup sweep once the application is ready and then on a fixed delay
 * Why: Reclaims expired rows without an external scheduler
 */
package org.campusbulletin.content.service;

import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.config.SweeperProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "content.sweeper.enabled", havingValue = "true")
public class CleanupSweepWorker {

  private final CleanupSweepService sweepService;
  private final SweeperProperties properties;

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    if (properties.runOnStartup()) {
      sweepService.sweep();
    }
  }

  // The first timed run waits one interval; the startup run covers boot.
  @Scheduled(
      fixedDelayString = "${content.sweeper.interval}",
      initialDelayString = "${content.sweeper.interval}")
  public void run() {
    sweepService.sweep();
  }
}
