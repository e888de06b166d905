package org.urbanscope.datapipeline.services.resolver;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.urbanscope.datapipeline.TestRecords;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AccessionPatternTest {

    @Test
    void firstIn_findsAccessionInsideProse() {
        assertThat(AccessionPattern.firstIn("Part of umbrella study prjeb4352, see also PRJNA1"))
            .contains(TestRecords.project("PRJEB4352"));
    }

    @Test
    void firstIn_requiresWordBoundaries() {
        assertThat(AccessionPattern.firstIn("XPRJNA123")).isEmpty();
        assertThat(AccessionPattern.firstIn("PRJNA123abc")).isEmpty();
        assertThat(AccessionPattern.firstIn("(PRJDB77)")).contains(TestRecords.project("PRJDB77"));
    }

    @Test
    void firstIn_ignoresUnknownPrefixes() {
        assertThat(AccessionPattern.firstIn("PRJXX123 SRP000001")).isEmpty();
        assertThat(AccessionPattern.firstIn(null)).isEmpty();
        assertThat(AccessionPattern.firstIn("")).isEmpty();
    }
}
