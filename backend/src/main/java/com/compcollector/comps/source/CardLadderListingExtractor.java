package com.compcollector.comps.source;

import com.compcollector.comps.model.ListingDetail;
import com.compcollector.comps.model.ListingTile;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class CardLadderListingExtractor implements ListingExtractor {
    static final String TILE_SELECTOR = "a[href]";
    private static final String HOST = "cardladder.com";

    @Override
    public List<ListingTile> extractTiles(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        Set<String> seen = new HashSet<>();
        List<ListingTile> tiles = new ArrayList<>();
        for (Element anchor : document.select(TILE_SELECTOR)) {
            String url = HtmlSupport.blankToNull(anchor.absUrl("href"));
            String title = HtmlSupport.blankToNull(anchor.text());
            if (url == null || title == null || !url.contains(HOST) || isNavigation(url) || !seen.add(url)) {
                continue;
            }
            tiles.add(new ListingTile(title, url, null, null, null));
        }
        return tiles;
    }

    @Override
    public ListingDetail extractDetail(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return ListingDetail.empty();
        }
        Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        Element ogImage = document.selectFirst("meta[property=og:image]");
        String image = ogImage == null ? null : HtmlSupport.blankToNull(ogImage.absUrl("content"));
        return new ListingDetail(null, image);
    }

    private static boolean isNavigation(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.contains("/search")
            || lower.contains("login")
            || lower.contains("signin")
            || lower.contains("signup");
    }
}
