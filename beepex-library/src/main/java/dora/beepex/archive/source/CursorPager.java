package dora.beepex.archive.source;

import dora.beepex.shared.dto.CursorPage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Walks a cursor-paginated listing from the newest page backwards.
 */
@Slf4j
public final class CursorPager {

    private CursorPager() {
    }

    /**
     * Requests pages until one reports {@code hasMore = false} or comes without an
     * oldest cursor, and returns all items in the order they were received.
     */
    public static <T> List<T> collect(String what, Function<String, CursorPage<T>> fetchPage) {
        List<T> items = new ArrayList<>();
        Set<String> seenCursors = new HashSet<>();
        String cursor = null;
        int pages = 0;
        while (true) {
            CursorPage<T> page = fetchPage.apply(cursor);
            pages++;
            if (page == null) {
                break;
            }
            if (page.getItems() != null) {
                items.addAll(page.getItems());
            }
            String next = page.getOldestCursor();
            if (!Boolean.TRUE.equals(page.getHasMore()) || next == null || next.isEmpty()) {
                break;
            }
            if (!seenCursors.add(next)) {
                log.warn("Cursor {} of {} was returned twice, stopping pagination", next, what);
                break;
            }
            cursor = next;
        }
        log.debug("Fetched {} {} in {} page(s)", items.size(), what, pages);
        return items;
    }
}
