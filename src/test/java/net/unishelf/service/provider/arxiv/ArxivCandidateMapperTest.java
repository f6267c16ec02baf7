package net.unishelf.service.provider.arxiv;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.unishelf.domain.resource.CandidateRecord;
import org.junit.jupiter.api.Test;

class ArxivCandidateMapperTest {

    private static final String FEED = """
        <?xml version="1.0" encoding="UTF-8"?>
        <feed xmlns="http://www.w3.org/2005/Atom">
          <title type="html">ArXiv Query: search_query=all:transformers</title>
          <id>http://arxiv.org/api/query</id>
          <entry>
            <id>http://arxiv.org/abs/1706.03762v7</id>
            <published>2017-06-12T17:57:34Z</published>
            <title>Attention Is All
              You Need</title>
            <summary>  The dominant sequence transduction models
              are based on recurrent networks. </summary>
            <author><name>Ashish Vaswani</name></author>
            <author><name>Noam Shazeer</name></author>
            <link href="http://arxiv.org/abs/1706.03762v7" rel="alternate" type="text/html"/>
            <link title="pdf" href="http://arxiv.org/pdf/1706.03762v7" rel="related" type="application/pdf"/>
          </entry>
          <entry>
            <id>http://arxiv.org/abs/2101.00001v1</id>
            <title>No links here</title>
          </entry>
        </feed>
        """;

    @Test
    void fromFeed_MapsEntries() {
        List<CandidateRecord> candidates = ArxivCandidateMapper.fromFeed(FEED);

        assertThat(candidates).hasSize(2);
        CandidateRecord first = candidates.get(0);
        assertThat(first.id()).isEqualTo("http://arxiv.org/abs/1706.03762v7");
        assertThat(first.title()).isEqualTo("Attention Is All You Need");
        assertThat(first.description()).isEqualTo("The dominant sequence transduction models are based on recurrent networks.");
        assertThat(first.authors()).containsExactly("Ashish Vaswani", "Noam Shazeer");
        assertThat(first.publishedDate()).isEqualTo("2017-06-12T17:57:34Z");
        assertThat(first.previewLink()).isEqualTo("http://arxiv.org/pdf/1706.03762v7");
        assertThat(first.infoLink()).isEqualTo("http://arxiv.org/abs/1706.03762v7");
        assertThat(first.sourceName()).isEqualTo("arXiv");
        assertThat(first.sourceExternalId()).isEqualTo("1706.03762v7");
    }

    @Test
    void fromFeed_EntryWithoutLinks_FallsBackToIdForInfo() {
        CandidateRecord second = ArxivCandidateMapper.fromFeed(FEED).get(1);

        assertThat(second.previewLink()).isNull();
        assertThat(second.infoLink()).isEqualTo("http://arxiv.org/abs/2101.00001v1");
        assertThat(second.usableLink()).isEqualTo("http://arxiv.org/abs/2101.00001v1");
        assertThat(second.authors()).containsExactly("Unknown");
    }

    @Test
    void fromFeed_BlankBody_ReturnsEmpty() {
        assertThat(ArxivCandidateMapper.fromFeed("  ")).isEmpty();
        assertThat(ArxivCandidateMapper.fromFeed(null)).isEmpty();
    }

    @Test
    void arxivIdentifier_StripsAbsPrefix() {
        assertThat(ArxivCandidateMapper.arxivIdentifier("http://arxiv.org/abs/hep-th/9901001v1")).isEqualTo("hep-th/9901001v1");
        assertThat(ArxivCandidateMapper.arxivIdentifier("1706.03762")).isEqualTo("1706.03762");
    }
}
