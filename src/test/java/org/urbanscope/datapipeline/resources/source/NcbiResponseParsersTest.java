package org.urbanscope.datapipeline.resources.source;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.urbanscope.datapipeline.api.resources.source.MalformedPayloadException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class NcbiResponseParsersTest {

    static final String SRA_SUMMARY = """
        <?xml version="1.0" encoding="UTF-8" ?>
        <eSummaryResult>
          <DocSum>
            <Id>31234567</Id>
            <Item Name="ExpXml" Type="String">&lt;Summary&gt;&lt;Title&gt;Subway swab 12&lt;/Title&gt;&lt;/Summary&gt;&lt;Bioproject&gt;prjna123456&lt;/Bioproject&gt;</Item>
            <Item Name="Title" Type="String">Subway swab 12</Item>
            <Item Name="Runs" Type="String">&lt;Run acc="SRR900001"/&gt;</Item>
            <Item Name="Keywords" Type="List">
              <Item Name="string" Type="String">urban</Item>
              <Item Name="string" Type="String">metagenome</Item>
            </Item>
          </DocSum>
        </eSummaryResult>
        """;

    @Test
    void parseSearchIds_readsIdList() throws MalformedPayloadException {
        List<String> ids = NcbiResponseParsers.parseSearchIds("""
            <eSearchResult><Count>2</Count><RetMax>2</RetMax>
              <IdList><Id>101</Id><Id> 102 </Id><Id></Id></IdList>
            </eSearchResult>
            """);

        assertThat(ids).containsExactly("101", "102");
    }

    @Test
    void parseSearchIds_emptyResultIsNotAnError() throws MalformedPayloadException {
        assertThat(NcbiResponseParsers.parseSearchIds("<eSearchResult><Count>0</Count><IdList/></eSearchResult>")).isEmpty();
    }

    @Test
    void errorElement_isReportedAsMalformed() {
        assertThatThrownBy(() -> NcbiResponseParsers.parseSearchIds(
            "<eSearchResult><ERROR>Search Backend failed</ERROR></eSearchResult>"))
            .isInstanceOf(MalformedPayloadException.class)
            .hasMessageContaining("Search Backend failed");
    }

    @Test
    void truncatedXml_isMalformed() {
        assertThatThrownBy(() -> NcbiResponseParsers.parseSearchIds("<eSearchResult><IdList><Id>1"))
            .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void parseLinkIds_deduplicates() throws MalformedPayloadException {
        List<String> ids = NcbiResponseParsers.parseLinkIds("""
            <eLinkResult><LinkSet><DbFrom>sra</DbFrom><IdList><Id>31234567</Id></IdList>
              <LinkSetDb><DbTo>bioproject</DbTo><LinkName>sra_bioproject</LinkName>
                <Link><Id>654321</Id></Link><Link><Id>654321</Id></Link><Link><Id>777</Id></Link>
              </LinkSetDb>
            </LinkSet></eLinkResult>
            """);

        assertThat(ids).containsExactly("654321", "777");
    }

    @Test
    void parseSraSummaries_flattensItemsAndGuessesProject() throws MalformedPayloadException {
        Map<String, NcbiResponseParsers.SraSummary> summaries = NcbiResponseParsers.parseSraSummaries(SRA_SUMMARY);

        NcbiResponseParsers.SraSummary summary = summaries.get("31234567");
        assertThat(summary).isNotNull();
        assertThat(summary.title()).isEqualTo("Subway swab 12");
        assertThat(summary.items()).containsEntry("Keywords", "urban; metagenome");
        assertThat(summary.projectGuess()).isEqualTo("PRJNA123456");
    }

    @Test
    void parseRunInfo_skipsRepeatedHeadersAndHonoursMaxRows() throws MalformedPayloadException {
        String csv = """
            Run,LibraryStrategy,BioProject,BioSample
            SRR900001,AMPLICON,PRJNA123456,SAMN000001

            Run,LibraryStrategy,BioProject,BioSample
            SRR900002,WGS,PRJNA123456,SAMN000002
            """;

        List<Map<String, String>> all = NcbiResponseParsers.parseRunInfo(csv, 10);
        assertThat(all).extracting(row -> row.get("Run")).containsExactly("SRR900001", "SRR900002");

        List<Map<String, String>> first = NcbiResponseParsers.parseRunInfo(csv, 1);
        assertThat(first).hasSize(1);
        assertThat(first.get(0)).containsEntry("LibraryStrategy", "AMPLICON").containsEntry("BioSample", "SAMN000001");
    }

    @Test
    void parseRunInfo_withoutRunColumnIsMalformed() {
        assertThatThrownBy(() -> NcbiResponseParsers.parseRunInfo("<html>rate limited</html>\n", 1))
            .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void parseProjectSummary_richLayout() throws MalformedPayloadException {
        Optional<ObjectNode> blob = NcbiResponseParsers.parseProjectSummary("654321", """
            <RecordSet><DocumentSummary>
              <Project>
                <ProjectID><ArchiveID accession="prjna123456" archive="NCBI" id="654321"/></ProjectID>
                <ProjectDescr><Title>City air microbiome</Title><Description>Air filters in 5 cities</Description></ProjectDescr>
                <ProjectType><ProjectTypeSubmission><IntendedDataTypeSet><DataType>metagenome</DataType></IntendedDataTypeSet></ProjectTypeSubmission></ProjectType>
              </Project>
              <Submission submitted="2023-04-01" last_update="2023-05-02">
                <Description><Organization role="owner"><Name>Urban Lab</Name></Organization></Description>
              </Submission>
            </DocumentSummary></RecordSet>
            """);

        assertThat(blob).isPresent();
        ObjectNode node = blob.get();
        assertThat(node.path("accession").asText()).isEqualTo("PRJNA123456");
        assertThat(node.path("title").asText()).isEqualTo("City air microbiome");
        assertThat(node.path("data_type").asText()).isEqualTo("metagenome");
        assertThat(node.path("submission_date").asText()).isEqualTo("2023-04-01");
        assertThat(node.path("center_name").asText()).isEqualTo("Urban Lab");
        assertThat(node.path("ncbi").path("bioproject_url").asText()).endsWith("/bioproject/654321");
    }

    @Test
    void parseProjectSummary_flatLayout() throws MalformedPayloadException {
        Optional<ObjectNode> blob = NcbiResponseParsers.parseProjectSummary("654321", """
            <eSummaryResult><DocumentSummarySet><DocumentSummary uid="654321">
              <Project_Acc>PRJNA123456</Project_Acc>
              <Project_Title>City air microbiome</Project_Title>
              <Organism_Name>air metagenome</Organism_Name>
              <Submitter_Organization_List><string></string><string>Urban Lab</string></Submitter_Organization_List>
            </DocumentSummary></DocumentSummarySet></eSummaryResult>
            """);

        assertThat(blob).isPresent();
        assertThat(blob.get().path("organism").asText()).isEqualTo("air metagenome");
        assertThat(blob.get().path("center_name").asText()).isEqualTo("Urban Lab");
    }

    @Test
    void parseProjectSummary_legacyLayoutKeepsRawItems() throws MalformedPayloadException {
        Optional<ObjectNode> blob = NcbiResponseParsers.parseProjectSummary("654321", """
            <eSummaryResult><DocSum><Id>654321</Id>
              <Item Name="Project_Acc" Type="String">PRJEB5555</Item>
              <Item Name="Title" Type="String">Sewage survey</Item>
            </DocSum></eSummaryResult>
            """);

        assertThat(blob).isPresent();
        assertThat(blob.get().path("accession").asText()).isEqualTo("PRJEB5555");
        assertThat(blob.get().path("title").asText()).isEqualTo("Sewage survey");
        assertThat(blob.get().path("esummary_items").path("Project_Acc").asText()).isEqualTo("PRJEB5555");
    }

    @Test
    void parseProjectSummary_withoutSummaryIsEmpty() throws MalformedPayloadException {
        assertThat(NcbiResponseParsers.parseProjectSummary("1", "<eSummaryResult/>")).isEmpty();
    }

    @Test
    void parseSampleDetail_readsAttributesTitleAndOrganism() throws MalformedPayloadException {
        Optional<ObjectNode> blob = NcbiResponseParsers.parseSampleDetail("""
            <BioSampleSet><BioSample accession="SAMN000001">
              <Description><Title>Swab 12</Title><Organism taxonomy_id="256318" taxonomy_name="metagenome"/></Description>
              <Attributes>
                <Attribute attribute_name="geo_loc_name" harmonized_name="geo_loc_name">USA: New York City</Attribute>
                <Attribute harmonized_name="lat_lon">40.75 N 73.98 W</Attribute>
                <Attribute attribute_name="empty"> </Attribute>
              </Attributes>
            </BioSample></BioSampleSet>
            """);

        assertThat(blob).isPresent();
        ObjectNode node = blob.get();
        assertThat(node.path("attributes").path("geo_loc_name").asText()).isEqualTo("USA: New York City");
        assertThat(node.path("attributes").path("lat_lon").asText()).isEqualTo("40.75 N 73.98 W");
        assertThat(node.path("attributes").has("empty")).isFalse();
        assertThat(node.path("title").asText()).isEqualTo("Swab 12");
        assertThat(node.path("organism").asText()).isEqualTo("metagenome");
    }

    @Test
    void parseSampleDetail_unknownSampleIsEmpty() throws MalformedPayloadException {
        assertThat(NcbiResponseParsers.parseSampleDetail("<BioSampleSet/>")).isEmpty();
    }

    @Test
    void externalEntities_areNotResolved() {
        String xxe = """
            <?xml version="1.0"?>
            <!DOCTYPE r [<!ENTITY x SYSTEM "file:///etc/passwd">]>
            <eSearchResult><IdList><Id>&x;</Id></IdList></eSearchResult>
            """;

        assertThat(searchIdsOrEmpty(xxe)).noneMatch(id -> id.contains("root:"));
    }

    private static List<String> searchIdsOrEmpty(String xml) {
        try {
            return NcbiResponseParsers.parseSearchIds(xml);
        } catch (MalformedPayloadException e) {
            return List.of();
        }
    }
}
