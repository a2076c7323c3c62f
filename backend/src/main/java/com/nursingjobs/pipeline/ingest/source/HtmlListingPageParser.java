package com.nursingjobs.pipeline.ingest.source;

import com.nursingjobs.pipeline.config.PipelineProperties.Selectors;
import com.nursingjobs.pipeline.ingest.model.ListingPage;
import com.nursingjobs.pipeline.ingest.model.RawListing;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class HtmlListingPageParser implements ListingPageParser {
    private static final String ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";

    private final String employerSlug;
    private final Selectors selectors;

    public HtmlListingPageParser(String employerSlug, Selectors selectors) {
        if (selectors == null || isBlank(selectors.getItem())) {
            throw new IllegalArgumentException("HTML source " + employerSlug + " requires an item selector");
        }
        this.employerSlug = employerSlug;
        this.selectors = selectors;
    }

    @Override
    public ListingPage parse(String body, String pageUrl) {
        Document document = Jsoup.parse(body == null ? "" : body, pageUrl == null ? "" : pageUrl);
        Element scope = document;
        if (!isBlank(selectors.getContainer())) {
            scope = document.selectFirst(selectors.getContainer());
            if (scope == null) {
                throw new AdapterFetchException(
                    employerSlug,
                    pageUrl,
                    "listing container '" + selectors.getContainer() + "' not found; page layout changed?"
                );
            }
        }

        List<RawListing> listings = new ArrayList<>();
        for (Element item : scope.select(selectors.getItem())) {
            listings.add(toListing(item));
        }
        String nextReference = null;
        boolean nextDisabled = false;
        if (!isBlank(selectors.getNext())) {
            Element next = document.selectFirst(selectors.getNext());
            if (next != null) {
                nextReference = firstNonBlank(next.absUrl("href"), next.attr("data-href"));
                nextDisabled = isDisabled(next) || isBlank(nextReference);
            }
        }
        return new ListingPage(listings, nextReference, nextDisabled, pageLinks(document));
    }

    @Override
    public String acceptHeader() {
        return ACCEPT;
    }

    private RawListing toListing(Element item) {
        Element titleElement = isBlank(selectors.getTitle()) ? item : item.selectFirst(selectors.getTitle());
        Element linkElement = isBlank(selectors.getLink()) ? titleElement : item.selectFirst(selectors.getLink());
        String url = null;
        if (linkElement != null) {
            url = firstNonBlank(linkElement.absUrl("href"), linkElement.attr("href"));
        }
        String externalId = null;
        if (!isBlank(selectors.getExternalIdAttr())) {
            externalId = firstNonBlank(
                item.attr(selectors.getExternalIdAttr()),
                linkElement == null ? null : linkElement.attr(selectors.getExternalIdAttr())
            );
        }
        return new RawListing(
            employerSlug,
            externalId,
            titleElement == null ? null : clean(titleElement.text()),
            text(item, selectors.getLocation()),
            url,
            text(item, selectors.getPostedDate()),
            text(item, selectors.getSalary()),
            text(item, selectors.getDepartment()),
            text(item, selectors.getEmploymentType()),
            text(item, selectors.getDescription())
        );
    }

    private Map<Integer, String> pageLinks(Document document) {
        Map<Integer, String> links = new LinkedHashMap<>();
        if (isBlank(selectors.getPageLinks())) {
            return links;
        }
        Elements anchors = document.select(selectors.getPageLinks());
        for (Element anchor : anchors) {
            Integer number = parsePageNumber(anchor.text());
            String href = anchor.absUrl("href");
            if (number != null && !isBlank(href) && !isDisabled(anchor)) {
                links.putIfAbsent(number, href);
            }
        }
        return links;
    }

    private boolean isDisabled(Element element) {
        if (element.hasAttr("disabled")) {
            return true;
        }
        if ("true".equalsIgnoreCase(element.attr("aria-disabled"))) {
            return true;
        }
        if (element.hasClass("disabled")) {
            return true;
        }
        Element parent = element.parent();
        if (parent != null && parent.hasClass("disabled")) {
            return true;
        }
        String href = element.attr("href").trim().toLowerCase(Locale.ROOT);
        return href.equals("#") || href.startsWith("javascript:");
    }

    private Integer parsePageNumber(String text) {
        String value = clean(text);
        if (value == null || !value.matches("\\d{1,5}")) {
            return null;
        }
        return Integer.parseInt(value);
    }

    private String text(Element item, String selector) {
        if (isBlank(selector)) {
            return null;
        }
        Element element = item.selectFirst(selector);
        return element == null ? null : clean(element.text());
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.replace(' ', ' ').replaceAll("\\s+", " ").trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value.trim();
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
