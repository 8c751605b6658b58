package com.dimensio.interfaces.api.extraction;

import com.dimensio.application.extraction.ExtractionAppService;
import com.dimensio.application.extraction.exception.TextTooLongException;
import com.dimensio.application.extraction.exception.UnsupportedLocaleException;
import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.model.ParseResult;
import com.dimensio.domain.extraction.model.ParseStats;
import com.dimensio.domain.extraction.model.ResolvedSpan;
import com.dimensio.domain.extraction.model.value.NumberValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExtractionController.class)
class ExtractionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ExtractionAppService extractionAppService;

    @Test
    @DisplayName("parse returns spans with their resolved values")
    void parse() throws Exception {
        ParseResult result = new ParseResult(
                List.of(new ResolvedSpan(6, 16, Dimensions.NUMERAL, "twenty one", new NumberValue(21), false)),
                new ParseStats(3, 42, 3, 1, true, false, 1));
        when(extractionAppService.parse(eq("about twenty one"), eq("en"), isNull(), isNull(), isNull()))
                .thenReturn(result);

        mockMvc.perform(post("/api/v1/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"about twenty one\",\"locale\":\"en\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.spans[0].dim").value("numeral"))
                .andExpect(jsonPath("$.spans[0].body").value("twenty one"))
                .andExpect(jsonPath("$.spans[0].value.value").value(21.0))
                .andExpect(jsonPath("$.spans[0].value.type").value("value"))
                .andExpect(jsonPath("$.stats.passes").value(3))
                .andExpect(jsonPath("$.stats.fixpointReached").value(true));
    }

    @Test
    @DisplayName("a missing locale fails validation")
    void validation() throws Exception {
        mockMvc.perform(post("/api/v1/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"five\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Locale is required"));
    }

    @Test
    @DisplayName("an unsupported locale maps to 400")
    void unsupportedLocale() throws Exception {
        when(extractionAppService.parse(anyString(), eq("fr"), any(), any(), any()))
                .thenThrow(new UnsupportedLocaleException("fr"));

        mockMvc.perform(post("/api/v1/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"cinq\",\"locale\":\"fr\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_LOCALE"));
    }

    @Test
    @DisplayName("too long text maps to 422")
    void textTooLong() throws Exception {
        when(extractionAppService.parse(anyString(), anyString(), any(), any(), any()))
                .thenThrow(new TextTooLongException(10));

        mockMvc.perform(post("/api/v1/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"far too long text\",\"locale\":\"en\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("TEXT_TOO_LONG"));
    }

    @Test
    @DisplayName("an unreadable body maps to 400")
    void unreadableBody() throws Exception {
        mockMvc.perform(post("/api/v1/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST_BODY"));
    }

    @Test
    @DisplayName("locales lists dimensions per locale and the length limit")
    void locales() throws Exception {
        when(extractionAppService.supportedLocales()).thenReturn(Map.of("en", Set.of("numeral")));
        when(extractionAppService.getMaxTextLength()).thenReturn(10000);

        mockMvc.perform(get("/api/v1/parse/locales"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.locales.en[0]").value("numeral"))
                .andExpect(jsonPath("$.maxTextLength").value(10000));
    }
}
