package dtm.strata.prototypes;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TagTest {

    @Test
    void tagsWithSameLabelAreDistinct() {
        Tag<String> first = Tag.of("config");
        Tag<String> second = Tag.of("config");

        assertNotEquals(first, second);
        assertEquals(first.getId(), second.getId());

        Map<Tag<?>, String> values = new HashMap<>();
        values.put(first, "a");
        values.put(second, "b");
        assertEquals(2, values.size());
        assertEquals("a", values.get(first));
    }

    @Test
    void anonymousTagsGetUniqueLabels() {
        Tag<Integer> first = Tag.anonymous();
        Tag<Integer> second = Tag.anonymous();

        assertTrue(first.getId().startsWith("tag#"));
        assertNotEquals(first.getId(), second.getId());
    }

    @Test
    void serviceTagKeepsDeclaredDependencies() {
        ValueTag<String> url = Tag.of("DATABASE_URL");
        ServiceTag<StringBuilder> builder = Tag.service(StringBuilder.class, url);

        assertEquals("StringBuilder", builder.getId());
        assertEquals(StringBuilder.class, builder.getType());
        assertEquals(List.of(url), builder.getDependencies());
        assertThrows(UnsupportedOperationException.class, () -> builder.getDependencies().add(url));
    }

    @Test
    void toStringIsTheLabel() {
        assertEquals("logger", Tag.of("logger").toString());
        assertEquals("repo", Tag.service("repo", Object.class).toString());
    }
}
