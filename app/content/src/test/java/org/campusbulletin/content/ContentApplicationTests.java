/*
 * Where: content application smoke test
 * What: Starts the full Spring context against Postgres
 * Why: Catches broken wiring and migrations early
 */
package org.campusbulletin.content;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ContentApplicationTests extends AbstractPostgresContainerTest {

  @Test
  void contextLoads() {}
}
