package com.dimensio.infrastructure.rules.nb;

import com.dimensio.domain.extraction.model.ResolvedSpan;
import com.dimensio.domain.extraction.model.value.NumberValue;
import com.dimensio.support.EngineFixture;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.dimensio.domain.extraction.model.Dimensions.NUMERAL;
import static org.assertj.core.api.Assertions.assertThat;

class NorwegianRuleBookTest {

    @ParameterizedTest(name = "\"{0}\" = {1}")
    @CsvSource({
            "tjue tre, 23",
            "åtte, 8",
            "to hundre og fem, 205",
            "3 komma 5, 3.5",
            "'1.000', 1000",
            "femten, 15",
            "minus 4, -4",
            "et par, 2"
    })
    void numeral(String text, double expected) {
        List<ResolvedSpan> spans = EngineFixture.parse(text, "nb", NUMERAL);

        assertThat(spans).hasSize(1);
        assertThat(spans.get(0).value()).isEqualTo(new NumberValue(expected));
        assertThat(spans.get(0).body()).isEqualTo(text);
    }
}
