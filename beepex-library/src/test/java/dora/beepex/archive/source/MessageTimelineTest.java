package dora.beepex.archive.source;

import dora.beepex.archive.model.Message;
import net.jqwik.api.*;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static dora.beepex.archive.Fixtures.T0;
import static dora.beepex.archive.Fixtures.message;
import static dora.beepex.archive.Fixtures.text;
import static org.assertj.core.api.Assertions.assertThat;

public class MessageTimelineTest {

    @Example
    void duplicateAcrossPagesKeepsFirstRecord() {
        Message first = message("m1", "ann", 0).text("first").build();
        Message again = message("m1", "ann", 0).text("edited").build();

        List<Message> result = MessageTimeline.normalize(List.of(first, text("m2", "ann", 1), again));

        assertThat(result).extracting(Message::getId).containsExactly("m1", "m2");
        assertThat(result.get(0).getText()).isEqualTo("first");
    }

    @Example
    void dropsBlankMessages() {
        List<Message> result = MessageTimeline.normalize(List.of(
                message("m1", "ann", 0).build(),
                message("m2", "ann", 1).text("").build()));

        assertThat(result).extracting(Message::getId).containsExactly("m2");
    }

    @Example
    void sortsByInstantAcrossOffsets() {
        Message early = message("b", "ann", 0)
                .timestamp(T0.withOffsetSameInstant(ZoneOffset.ofHours(5)))
                .text("x").build();
        Message late = message("a", "ann", 1).text("y").build();

        assertThat(MessageTimeline.normalize(List.of(late, early)))
                .extracting(Message::getId).containsExactly("b", "a");
    }

    @Example
    void sameTimestampUsesNumericOrderingKeyThenId() {
        Message k10 = message("x", "ann", 0).orderingKey("10").text("x").build();
        Message k9 = message("y", "ann", 0).orderingKey("9").text("y").build();
        Message other = message("a", "ann", 0).orderingKey("abc").text("z").build();
        Message alsoOther = message("b", "ann", 0).orderingKey("abc").text("z").build();

        assertThat(MessageTimeline.normalize(List.of(alsoOther, other, k10, k9)))
                .extracting(Message::getId).containsExactly("y", "x", "a", "b");
    }

    @Property(tries = 200)
    void orderingKeyComparisonIsConsistent(@ForAll("keys") String a, @ForAll("keys") String b,
                                           @ForAll("keys") String c) {
        List<String> keys = new ArrayList<>(List.of(a, b, c));
        Collections.shuffle(keys);
        keys.sort(MessageTimeline.ORDERING_KEY);

        assertThat(MessageTimeline.compareOrderingKeys(keys.get(0), keys.get(1))).isLessThanOrEqualTo(0);
        assertThat(MessageTimeline.compareOrderingKeys(keys.get(1), keys.get(2))).isLessThanOrEqualTo(0);
        assertThat(MessageTimeline.compareOrderingKeys(keys.get(0), keys.get(2))).isLessThanOrEqualTo(0);
        assertThat(Integer.signum(MessageTimeline.compareOrderingKeys(a, b)))
                .isEqualTo(-Integer.signum(MessageTimeline.compareOrderingKeys(b, a)));
    }

    @Provide
    Arbitrary<String> keys() {
        return Arbitraries.oneOf(
                Arbitraries.longs().between(-1000, 100000).map(String::valueOf),
                Arbitraries.strings().alpha().numeric().ofMaxLength(6),
                Arbitraries.of("", "-", "007", "7"));
    }
}
