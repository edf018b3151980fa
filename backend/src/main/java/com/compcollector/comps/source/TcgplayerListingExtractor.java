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
import java.util.Set;

@Component
public class TcgplayerListingExtractor implements ListingExtractor {
    static final String TILE_SELECTOR = "a[href*='/product/']";
    private static final List<String> PRICE_SELECTORS = List.of(
        "span[data-testid=product-price]",
        "span.price",
        "span.product-details__price",
        "span[data-testid=pricing-price]"
    );

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
            if (url == null || title == null || !seen.add(url)) {
                continue;
            }
            Element img = anchor.selectFirst("img");
            String imageUrl = img == null ? null : HtmlSupport.blankToNull(img.absUrl("src"));
            tiles.add(new ListingTile(title, url, null, null, imageUrl));
        }
        return tiles;
    }

    @Override
    public ListingDetail extractDetail(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return ListingDetail.empty();
        }
        Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        String price = null;
        for (String selector : PRICE_SELECTORS) {
            price = HtmlSupport.text(document, selector);
            if (price != null) {
                break;
            }
        }
        if (price == null) {
            for (Element span : document.select("span")) {
                String text = HtmlSupport.blankToNull(span.text());
                if (text != null && text.contains("$")) {
                    price = text;
                    break;
                }
            }
        }
        Element ogImage = document.selectFirst("meta[property=og:image]");
        String image = ogImage == null ? null : HtmlSupport.blankToNull(ogImage.absUrl("content"));
        return new ListingDetail(price, image);
    }
}
