package org.smae.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.smae.domain.ontology.MetabolicNetwork.CARBON;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.smae.domain.events.Event;
import org.smae.testutil.EventFixtures;

class TagValidatorTest {
  private final TagValidator validator = new TagValidator();

  @Test
  void taggedBatchPassesUnchanged() {
    List<Event> events = List.of(EventFixtures.tagged("a", CARBON), EventFixtures.tagged("b", CARBON));

    assertEquals(events, validator.validate(events));
  }

  @Test
  void missingNetworkRejectsWholeBatch() {
    Event untagged = EventFixtures.event("evt-9").build();
    List<Event> events = List.of(EventFixtures.tagged("a", CARBON), untagged);

    UntaggedNetworkException ex =
        assertThrows(UntaggedNetworkException.class, () -> validator.validate(events));
    assertEquals("evt-9", ex.eventId());
    assertEquals("Event evt-9 has no network assignment", ex.getMessage());
  }

  @Test
  void missingLayerRejected() {
    Event noLayer = EventFixtures.event("evt-3", CARBON).layers(List.of()).build();

    UntaggedLayerException ex =
        assertThrows(UntaggedLayerException.class, () -> validator.validate(List.of(noLayer)));
    assertEquals("Event evt-3 has no layer assignment", ex.getMessage());
  }

  @Test
  void validationErrorsAreIllegalArguments() {
    Event untagged = EventFixtures.event("evt-1").build();

    assertThrows(IllegalArgumentException.class, () -> validator.validate(List.of(untagged)));
  }
}
