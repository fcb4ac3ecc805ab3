package org.iceforge.tabula.function.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.tabula.core.query.QueryBuilder;
import org.iceforge.tabula.core.query.QueryModels;
import org.iceforge.tabula.core.query.RequestValidator;
import org.iceforge.tabula.core.query.TypeTag;
import org.iceforge.tabula.function.query.QueryExecutor;
import org.iceforge.tabula.function.query.TableQueryService;
import org.iceforge.tabula.function.warehouse.WarehouseClient;
import org.iceforge.tabula.function.warehouse.WarehouseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class QueryFunctionControllerTest {

    private WarehouseClient warehouse;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        warehouse = mock(WarehouseClient.class);

        TableQueryService service = new TableQueryService(
                new RequestValidator(), new QueryBuilder(), new QueryExecutor(warehouse));
        QueryFunctionController controller = new QueryFunctionController(service, new ObjectMapper());

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new FunctionExceptionHandler())
                .addFilters(new CorsHeadersFilter())
                .build();
    }

    private static Map<String, Object> row(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    /* ---------- CORS / method handling ---------- */

    @Test
    void preflight_returns204_withCorsHeaders() throws Exception {
        mockMvc.perform(options("/")
                        .header("Origin", "https://example.org")
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isNoContent())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                .andExpect(header().string("Access-Control-Allow-Methods", "POST"))
                .andExpect(header().string("Access-Control-Allow-Headers", "Content-Type, Authorization"))
                .andExpect(header().string("Access-Control-Max-Age", "3600"))
                .andExpect(content().string(""));

        verifyNoInteractions(warehouse);
    }

    @Test
    void get_returns405() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Method not allowed. Use POST."));
    }

    @Test
    void putAndDelete_return405() throws Exception {
        mockMvc.perform(put("/").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isMethodNotAllowed());
        mockMvc.perform(delete("/query"))
                .andExpect(status().isMethodNotAllowed());
        verifyNoInteractions(warehouse);
    }

    /* ---------- POST: input errors ---------- */

    @Test
    void malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Invalid JSON payload."))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    void malformedJson_trailingGarbage_returns400() throws Exception {
        mockMvc.perform(post("/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p\",\"datasetId\":\"d\",\"tableId\":\"t\",\"columns\":[\"x\"]} this is not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Invalid JSON payload."));

        verifyNoInteractions(warehouse);
    }

    @Test
    void unexpectedException_returns500Envelope() throws Exception {
        TableQueryService failing = mock(TableQueryService.class);
        when(failing.run(any())).thenThrow(new IllegalStateException("boom"));
        MockMvc failingMvc = MockMvcBuilders
                .standaloneSetup(new QueryFunctionController(failing, new ObjectMapper()))
                .setControllerAdvice(new FunctionExceptionHandler())
                .addFilters(new CorsHeadersFilter())
                .build();

        failingMvc.perform(post("/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p\",\"datasetId\":\"d\",\"tableId\":\"t\",\"columns\":[\"x\"]}"))
                .andExpect(status().isInternalServerError())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(startsWith("Internal error:")))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    void emptyBody_returns400() throws Exception {
        mockMvc.perform(post("/").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid JSON payload."));
    }

    @Test
    void emptyColumns_returns400_withoutTouchingWarehouse() throws Exception {
        mockMvc.perform(post("/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p\",\"datasetId\":\"d\",\"tableId\":\"t\",\"columns\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one column must be selected."));

        verifyNoInteractions(warehouse);
    }

    @Test
    void limitOutOfRange_returns400() throws Exception {
        mockMvc.perform(post("/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p\",\"datasetId\":\"d\",\"tableId\":\"t\",\"columns\":[\"x\"],\"limit\":5001}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("between 1 and 5000")));

        verifyNoInteractions(warehouse);
    }

    @Test
    void injectionInTableId_returns400() throws Exception {
        mockMvc.perform(post("/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p\",\"datasetId\":\"d\",\"tableId\":\"t` WHERE 1=1; --\",\"columns\":[\"x\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("Invalid identifier for tableId")));

        verifyNoInteractions(warehouse);
    }

    /* ---------- POST: success / execution ---------- */

    @Test
    void minimalQuery_runsSqlWithoutWhere_andReturnsRows() throws Exception {
        when(warehouse.execute(anyString(), anyList()))
                .thenReturn(List.of(row("x", "a"), row("x", "b")));

        mockMvc.perform(post("/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p\",\"datasetId\":\"d\",\"tableId\":\"t\",\"columns\":[\"x\"],\"limit\":10}"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].x").value("a"))
                .andExpect(jsonPath("$.data[1].x").value("b"))
                .andExpect(jsonPath("$.error").doesNotExist());

        verify(warehouse).execute(eq("SELECT `x` FROM `p.d.t` LIMIT 10"), eq(List.of()));
    }

    @SuppressWarnings("unchecked")
    @Test
    void filters_areBoundAsParameters() throws Exception {
        when(warehouse.execute(anyString(), anyList())).thenReturn(List.of());
        ArgumentCaptor<List<QueryModels.BoundParameter>> params = ArgumentCaptor.forClass(List.class);

        mockMvc.perform(post("/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"projectId":"p","datasetId":"d","tableId":"t","columns":["name","age"],
                                 "filters":[{"column":"age","operator":">","value":30},
                                            {"column":"status","operator":"in","value":"a, b,c"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").isEmpty());

        verify(warehouse).execute(eq("SELECT `name`, `age` FROM `p.d.t` WHERE `age` > @param_0"
                + " AND `status` IN (@param_1_0, @param_1_1, @param_1_2) LIMIT 1000"), params.capture());
        assertThat(params.getValue()).containsExactly(
                new QueryModels.BoundParameter("param_0", TypeTag.INT64, 30L),
                new QueryModels.BoundParameter("param_1_0", TypeTag.STRING, "a"),
                new QueryModels.BoundParameter("param_1_1", TypeTag.STRING, "b"),
                new QueryModels.BoundParameter("param_1_2", TypeTag.STRING, "c"));
    }

    @Test
    void anyPathServesTheFunction() throws Exception {
        when(warehouse.execute(anyString(), anyList())).thenReturn(List.of(row("x", 1L)));

        mockMvc.perform(post("/query-bigquery")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p\",\"datasetId\":\"d\",\"tableId\":\"t\",\"columns\":[\"x\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].x").value(1));
    }

    @Test
    void forwardedPayloadWithExtraKeys_isAccepted() throws Exception {
        when(warehouse.execute(anyString(), anyList())).thenReturn(List.of(row("sku", "A-1")));

        // Table coordinates merged with the UI's query object by an upstream gateway.
        mockMvc.perform(post("/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"projectId":"p","datasetId":"d","tableId":"orders",
                                 "entity_name":"orders","columns":["sku"],
                                 "filters":[{"column":"sku","operator":"=","value":"A-1"}],"limit":1000}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].sku").value("A-1"));

        verify(warehouse).execute(eq("SELECT `sku` FROM `p.d.orders` WHERE `sku` = @param_0 LIMIT 1000"), anyList());
    }

    @Test
    void warehouseFailure_returns500_withWarehouseMessage() throws Exception {
        when(warehouse.execute(anyString(), anyList()))
                .thenThrow(new WarehouseException("Not found: Table p:d.t was not found in location US"));

        mockMvc.perform(post("/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":\"p\",\"datasetId\":\"d\",\"tableId\":\"t\",\"columns\":[\"x\"]}"))
                .andExpect(status().isInternalServerError())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error")
                        .value("BigQuery query failed: Not found: Table p:d.t was not found in location US"));
    }
}
