/*
 * Where: content service layer
 * What: Toggles taxonomy activation and returns the active set per level
 * Why: Registration screens only offer branches, years and semesters whose whole ancestry is active
 */
package org.campusbulletin.content.service;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.ContentNotFoundException;
import org.campusbulletin.content.model.TaxonomyEntry;
import org.campusbulletin.content.model.TaxonomyKind;
import org.campusbulletin.content.repository.TaxonomyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TaxonomyService {

  private static final Logger logger = LoggerFactory.getLogger(TaxonomyService.class);

  private final TaxonomyRepository taxonomyRepository;

  public void setActive(TaxonomyKind kind, UUID id, boolean active) {
    if (taxonomyRepository.setActive(kind, id, active) == 0) {
      throw new ContentNotFoundException(kind.name().toLowerCase(Locale.ROOT), id);
    }
    logger.info("taxonomy activation changed kind={} id={} active={}", kind, id, active);
  }

  public List<TaxonomyEntry> activeSet(TaxonomyKind kind) {
    return taxonomyRepository.findActive(kind);
  }
}
