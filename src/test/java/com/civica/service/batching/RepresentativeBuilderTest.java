package com.civica.service.batching;

import com.civica.model.ActorSnapshot;
import com.civica.model.RequestType;
import com.civica.support.Actors;
import com.civica.support.Requests;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RepresentativeBuilder.
 */
class RepresentativeBuilderTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static PendingRequest request(long seq, ActorSnapshot snapshot) {
        return Requests.pending(seq, snapshot, RequestType.GENERAL_ANALYSIS, NOW);
    }

    @Test
    void testSingleMemberIsItsOwnRepresentative() {
        ActorSnapshot voter = Actors.voter(7, 30, 2);

        assertSame(voter, RepresentativeBuilder.build(List.of(request(1, voter))));
    }

    @Test
    void testNumericFieldsAreAveraged() {
        ActorSnapshot a = Actors.withBehavior(Actors.voter(1, 30, 3, 0.1, 0.2, 0.3), 0.2, 0.4, 0.6);
        ActorSnapshot b = Actors.withBehavior(Actors.voter(2, 35, 3, 0.3, 0.4, 0.5), 0.4, 0.6, 0.8);

        ActorSnapshot representative = RepresentativeBuilder.build(List.of(request(1, a), request(2, b)));

        assertEquals(RepresentativeBuilder.REPRESENTATIVE_ACTOR_ID, representative.getActorId());
        assertEquals(33, representative.getAge());
        assertEquals(0.2, representative.getOpinion().getEconomic(), 1e-9);
        assertEquals(0.3, representative.getOpinion().getSocial(), 1e-9);
        assertEquals(0.4, representative.getOpinion().getEnvironmental(), 1e-9);
        assertEquals(0.3, representative.getBehavior().getSatisfaction(), 1e-9);
        assertEquals(0.5, representative.getBehavior().getEngagement(), 1e-9);
        assertEquals(0.7, representative.getBehavior().getVolatility(), 1e-9);
    }

    @Test
    void testCategoricalFieldsTakeTheMode() {
        ActorSnapshot base = Actors.voter(1, 40, 3);
        List<PendingRequest> members = List.of(
                request(1, base.toBuilder().incomeBracket(2).region("Zeeland").build()),
                request(2, base.toBuilder().incomeBracket(7).region("Utrecht").build()),
                request(3, base.toBuilder().incomeBracket(7).region("Utrecht").build()));

        ActorSnapshot representative = RepresentativeBuilder.build(members);

        assertEquals(7, representative.getIncomeBracket());
        assertEquals("Utrecht", representative.getRegion());
        assertEquals(3, representative.getEducationLevel());
    }

    @Test
    void testModeTieKeepsEarliestValueAndSkipsNulls() {
        ActorSnapshot base = Actors.voter(1, 40, 3);
        List<PendingRequest> members = List.of(
                request(1, base.toBuilder().region(null).build()),
                request(2, base.toBuilder().region("Drenthe").build()),
                request(3, base.toBuilder().region("Limburg").build()));

        assertEquals("Drenthe", RepresentativeBuilder.build(members).getRegion());
    }

    @Test
    void testEmptyClusterIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> RepresentativeBuilder.build(List.of()));
    }
}
