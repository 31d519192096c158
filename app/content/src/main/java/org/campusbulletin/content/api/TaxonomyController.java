package org.campusbulletin.content.api;

import jakarta.validation.Valid;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.request.SetActiveRequest;
import org.campusbulletin.content.api.response.TaxonomyResponse;
import org.campusbulletin.content.model.TaxonomyKind;
import org.campusbulletin.content.service.TaxonomyService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class TaxonomyController {

  private final TaxonomyService taxonomyService;

  @GetMapping("/v1/taxonomy/{kind}")
  public ResponseEntity<TaxonomyResponse> activeSet(@PathVariable("kind") String kind) {
    final TaxonomyKind taxonomyKind = TaxonomyKind.parse(kind);
    return ResponseEntity.ok(
        new TaxonomyResponse(
            taxonomyKind.name().toLowerCase(Locale.ROOT),
            taxonomyService.activeSet(taxonomyKind).stream()
                .map(TaxonomyResponse.Entry::from)
                .toList()));
  }

  @PutMapping("/v1/admin/taxonomy/{kind}/{id}/active")
  public ResponseEntity<Void> setActive(
      @PathVariable("kind") String kind,
      @PathVariable("id") UUID id,
      @Valid @RequestBody SetActiveRequest request) {
    taxonomyService.setActive(TaxonomyKind.parse(kind), id, request.active());
    return ResponseEntity.noContent().build();
  }
}
