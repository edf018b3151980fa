package com.compcollector.comps.source;

import com.compcollector.comps.model.ListingDetail;
import com.compcollector.comps.model.ListingTile;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class EbaySoldListingExtractor implements ListingExtractor {
    static final String TILE_SELECTOR = "li.s-item";
    private static final String AD_TITLE = "Shop on eBay";
    private static final Pattern SOLD_PREFIX = Pattern.compile("^sold\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEW_LISTING_PREFIX = Pattern.compile("^new listing\\s*", Pattern.CASE_INSENSITIVE);

    @Override
    public List<ListingTile> extractTiles(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        List<ListingTile> tiles = new ArrayList<>();
        for (Element item : document.select(TILE_SELECTOR)) {
            String title = cleanTitle(HtmlSupport.text(item, ".s-item__title"));
            String url = HtmlSupport.absAttr(item, "a.s-item__link", "href");
            if (title == null || url == null || title.contains(AD_TITLE)) {
                continue;
            }
            tiles.add(new ListingTile(
                title,
                url,
                HtmlSupport.text(item, ".s-item__price"),
                cleanSoldDate(HtmlSupport.firstNonBlank(
                    HtmlSupport.text(item, ".s-item__ended-date"),
                    HtmlSupport.text(item, ".s-item__caption--signal")
                )),
                imageUrl(item.selectFirst(".s-item__image-img"))
            ));
        }
        return tiles;
    }

    /**
     * Looser pass used when the structured tile markup yields nothing: any anchor pointing at an
     * item page with visible text. These tiles carry no price or date.
     */
    public List<ListingTile> extractFallbackTiles(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        Set<String> seen = new LinkedHashSet<>();
        List<ListingTile> tiles = new ArrayList<>();
        for (Element anchor : document.select("a[href*='/itm/']")) {
            String url = HtmlSupport.blankToNull(anchor.absUrl("href"));
            String title = cleanTitle(HtmlSupport.blankToNull(anchor.text()));
            if (url == null || title == null || title.contains(AD_TITLE) || !seen.add(stripQuery(url))) {
                continue;
            }
            tiles.add(new ListingTile(title, url, null, null, imageUrl(anchor.selectFirst("img"))));
        }
        return tiles;
    }

    @Override
    public ListingDetail extractDetail(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return ListingDetail.empty();
        }
        Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        String price = HtmlSupport.firstNonBlank(
            HtmlSupport.text(document, ".x-price-primary span.ux-textspans"),
            HtmlSupport.text(document, "span.ux-textspans")
        );
        String image = null;
        Element ogImage = document.selectFirst("meta[property=og:image]");
        if (ogImage != null) {
            image = HtmlSupport.blankToNull(ogImage.absUrl("content"));
        }
        if (image == null) {
            image = HtmlSupport.absAttr(document, "#icImg", "src");
        }
        return new ListingDetail(price, image);
    }

    static String cleanSoldDate(String value) {
        if (value == null) {
            return null;
        }
        return HtmlSupport.blankToNull(SOLD_PREFIX.matcher(value.strip()).replaceFirst(""));
    }

    private static String cleanTitle(String value) {
        if (value == null) {
            return null;
        }
        return HtmlSupport.blankToNull(NEW_LISTING_PREFIX.matcher(value).replaceFirst(""));
    }

    private static String imageUrl(Element img) {
        if (img == null) {
            return null;
        }
        String lazy = HtmlSupport.blankToNull(img.absUrl("data-src"));
        if (lazy != null) {
            return lazy;
        }
        String src = HtmlSupport.blankToNull(img.absUrl("src"));
        return HtmlSupport.isHttpUrl(src) ? src : null;
    }

    private static String stripQuery(String url) {
        int index = url.indexOf('?');
        return index < 0 ? url : url.substring(0, index);
    }
}
