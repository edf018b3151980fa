package com.compcollector.comps.source;

import com.compcollector.comps.browser.SourceAutomationException;
import com.compcollector.comps.browser.SourcePage;
import com.compcollector.comps.model.ErrorKind;
import com.compcollector.comps.model.PlaybookRule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlaybookRuleApplierTest {
    private static final String URL = "https://www.ebay.com/sch/i.html?_nkw=herbert&LH_Sold=1";

    @Mock
    private SourcePage page;

    private final PlaybookRuleApplier applier = new PlaybookRuleApplier();

    @Test
    void enabledRulesRunByDescendingPriority() {
        when(page.url()).thenReturn(URL);
        when(page.click("#gdpr-banner-accept")).thenReturn(true);
        when(page.clickByText("Sold Items")).thenReturn(true);
        List<PlaybookRule> rules = List.of(
            rule("low", "click_text", null, "Sold Items", 1, true),
            rule("off", "click", "#disabled", null, 50, false),
            rule("high", "click", "#gdpr-banner-accept", null, 10, true)
        );

        int applied = applier.apply(page, rules);

        assertEquals(2, applied);
        InOrder order = inOrder(page);
        order.verify(page).click("#gdpr-banner-accept");
        order.verify(page).clickByText("Sold Items");
        verify(page, never()).click("#disabled");
    }

    @Test
    void rulesForOtherPagesAreSkipped() {
        when(page.url()).thenReturn(URL);
        PlaybookRule itemOnly = new PlaybookRule("item", "ebay_sold", "click", "#see-all", "/itm/", null, 1, true);

        assertEquals(0, applier.apply(page, List.of(itemOnly)));
        verify(page, never()).click(anyString());
    }

    @Test
    void failingRuleDoesNotStopTheRest() {
        when(page.url()).thenReturn(URL);
        when(page.waitForSelector("li.s-item", 3000))
            .thenThrow(new SourceAutomationException(ErrorKind.OTHER, "selector detached"));
        when(page.scrollByViewport()).thenReturn(true);

        int applied = applier.apply(page, List.of(
            rule("wait", "wait", "li.s-item", null, 5, true),
            rule("scroll", "scroll", null, null, 1, true),
            rule("mystery", "hover", "#x", null, 0, true)
        ));

        assertEquals(1, applied);
    }

    @Test
    void crashedPageStopsRuleReplay() {
        when(page.url()).thenReturn(URL);
        when(page.click("#accept")).thenThrow(new SourceAutomationException(ErrorKind.SESSION_CRASHED, "Target crashed"));

        assertThrows(SourceAutomationException.class,
            () -> applier.apply(page, List.of(rule("a", "click", "#accept", null, 1, true))));
        verify(page, never()).waitForTimeout(anyInt());
    }

    @Test
    void orderedDropsDisabledRules() {
        assertThat(PlaybookRuleApplier.ordered(null)).isEmpty();
        assertThat(PlaybookRuleApplier.ordered(List.of(
            rule("a", "click", "#a", null, 1, false),
            rule("b", "click", "#b", null, 3, true),
            rule("c", "click", "#c", null, 7, true)
        ))).extracting(PlaybookRule::id).containsExactly("c", "b");
    }

    private PlaybookRule rule(String id, String action, String selector, String label, int priority, boolean enabled) {
        return new PlaybookRule(id, "ebay_sold", action, selector, null, label, priority, enabled);
    }
}
