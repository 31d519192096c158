package org.campusbulletin.content.api;

import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.response.SweepResponse;
import org.campusbulletin.content.service.CleanupSweepService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/** Forced cleanup; runs the same sweep the timer runs. */
@RestController
@RequiredArgsConstructor
public class SweepAdminController {

  private final CleanupSweepService sweepService;

  @PostMapping("/v1/admin/sweeps")
  public ResponseEntity<SweepResponse> sweep() {
    return ResponseEntity.ok(SweepResponse.from(sweepService.sweep()));
  }
}
