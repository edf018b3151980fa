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
public class PriceChartingListingExtractor implements ListingExtractor {
    static final String TILE_SELECTOR = "a[href*='/game/']";
    private static final String GAME_PATH = "pricecharting.com/game";

    @Override
    public List<ListingTile> extractTiles(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        Set<String> seen = new HashSet<>();
        List<ListingTile> tiles = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            String url = HtmlSupport.blankToNull(anchor.absUrl("href"));
            String title = HtmlSupport.blankToNull(anchor.text());
            if (url == null || title == null || !url.contains(GAME_PATH) || !seen.add(url)) {
                continue;
            }
            Element row = anchor.closest("tr");
            String price = row == null ? null : HtmlSupport.text(row, "td.used_price .js-price, td.price .js-price");
            Element img = row == null ? null : row.selectFirst("img");
            String imageUrl = img == null ? null : HtmlSupport.blankToNull(img.absUrl("src"));
            tiles.add(new ListingTile(title, url, price, null, imageUrl));
        }
        return tiles;
    }

    @Override
    public ListingDetail extractDetail(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return ListingDetail.empty();
        }
        Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        String price = HtmlSupport.text(document, "#used_price .price");
        String image = HtmlSupport.absAttr(document, "#product_details img", "src");
        return new ListingDetail(price, image);
    }
}
