package net.unishelf.service.provider.arxiv;

import java.util.ArrayList;
import java.util.List;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.service.provider.ProviderPayloads;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

/**
 * The only code that reads arXiv Atom feeds.
 */
final class ArxivCandidateMapper {

    static final String SOURCE_NAME = "arXiv";

    private ArxivCandidateMapper() {
    }

    static List<CandidateRecord> fromFeed(String atomXml) {
        List<CandidateRecord> candidates = new ArrayList<>();
        if (atomXml == null || atomXml.isBlank()) {
            return candidates;
        }
        Document feed = Jsoup.parse(atomXml, "", Parser.xmlParser());
        for (Element entry : feed.select("feed > entry")) {
            CandidateRecord candidate = fromEntry(entry);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    static CandidateRecord fromEntry(Element entry) {
        String id = childText(entry, "id");
        if (id == null) {
            return null;
        }
        List<String> authors = new ArrayList<>();
        for (Element name : entry.select("> author > name")) {
            String value = collapse(name.text());
            if (value != null) {
                authors.add(value);
            }
        }
        String absLink = null;
        String pdfLink = null;
        for (Element link : entry.select("> link")) {
            String href = ProviderPayloads.emptyToNull(link.attr("href"));
            if (href == null) {
                continue;
            }
            if ("pdf".equals(link.attr("title")) && pdfLink == null) {
                pdfLink = href;
            } else if ("alternate".equals(link.attr("rel")) && absLink == null) {
                absLink = href;
            }
        }
        return new CandidateRecord(
            id,
            childText(entry, "title"),
            childText(entry, "summary"),
            authors,
            childText(entry, "published"),
            null,
            pdfLink != null ? pdfLink : absLink,
            absLink != null ? absLink : id,
            SOURCE_NAME,
            arxivIdentifier(id)
        );
    }

    /**
     * {@code http://arxiv.org/abs/2101.00001v2} becomes {@code 2101.00001v2}.
     */
    static String arxivIdentifier(String idUrl) {
        int marker = idUrl.indexOf("/abs/");
        if (marker >= 0) {
            return idUrl.substring(marker + "/abs/".length());
        }
        int slash = idUrl.lastIndexOf('/');
        return slash >= 0 && slash < idUrl.length() - 1 ? idUrl.substring(slash + 1) : idUrl;
    }

    private static String childText(Element entry, String tag) {
        Element child = entry.selectFirst("> " + tag);
        return child == null ? null : collapse(child.text());
    }

    // Atom titles and summaries are hard-wrapped
    private static String collapse(String value) {
        if (value == null) {
            return null;
        }
        return ProviderPayloads.emptyToNull(value.replaceAll("\\s+", " ").trim());
    }
}
