package com.flagship.coop_ledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.coop_ledger.audit.AuditAction;
import com.flagship.coop_ledger.audit.AuditLogEntity;
import com.flagship.coop_ledger.audit.AuditLogRepository;
import com.flagship.coop_ledger.common.web.ApiHeaders;
import com.flagship.coop_ledger.daybook.BusinessCalendar;
import com.flagship.coop_ledger.daybook.DayBookService;
import com.flagship.coop_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Chart of accounts and manual journal endpoints.
 */
@AutoConfigureMockMvc
class JournalControllerTest extends IntegrationTestSupport {

    private static final String OPERATOR = "accountant-1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private DayBookService dayBookService;

    @Autowired
    private BusinessCalendar calendar;

    @Autowired
    private AuditLogRepository auditLogRepository;

    private String tenantId;

    @BeforeEach
    void setUp() {
        tenantId = newTenant();
    }

    @Test
    @DisplayName("Creating an account returns 201 and leaves an audit record")
    void createAccount() throws Exception {
        printTestHeader("Create Account");

        MvcResult result = mockMvc.perform(post("/api/accounts")
                .header(ApiHeaders.TENANT_ID, tenantId)
                .header(ApiHeaders.USER_ID, OPERATOR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\":\"00-10100-01-00001\",\"name\":\"Main Vault\",\"account_type\":\"ASSET\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.code").value("00-10100-01-00001"))
            .andExpect(jsonPath("$.group").value(false))
            .andExpect(jsonPath("$.balance").value(0))
            .andReturn();

        String accountId = objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText();
        mockMvc.perform(put("/api/accounts/roles/VAULT_CASH")
                .header(ApiHeaders.TENANT_ID, tenantId)
                .header(ApiHeaders.USER_ID, OPERATOR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"account_id\":\"" + accountId + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(accountId));

        List<AuditLogEntity> audit = auditLogRepository.findByTenantIdOrderByCreatedAtAsc(tenantId);
        printOutput("Audit actions", audit.stream().map(AuditLogEntity::getAction).toList());
        assertEquals(List.of(AuditAction.ACCOUNT_CREATED, AuditAction.ACCOUNT_ROLE_ASSIGNED),
            audit.stream().map(AuditLogEntity::getAction).toList());
        assertEquals(OPERATOR, audit.get(0).getActorId());
    }

    @Test
    @DisplayName("Manual journals need an open day and are dated into it")
    void manualJournal() throws Exception {
        printTestHeader("Manual Journal");
        Chart chart = setUpChart(tenantId);
        String body = "{\"description\":\"Member deposit\",\"lines\":["
            + "{\"account_id\":\"" + chart.vault.getId() + "\",\"debit\":250.00},"
            + "{\"account_id\":\"" + chart.memberDeposits.getId() + "\",\"credit\":250.00}]}";

        mockMvc.perform(post("/api/journal-entries")
                .header(ApiHeaders.TENANT_ID, tenantId)
                .header(ApiHeaders.USER_ID, OPERATOR)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("NO_ACTIVE_DAY"));

        dayBookService.startDay(tenantId, calendar.today(), OPERATOR);

        MvcResult posted = mockMvc.perform(post("/api/journal-entries")
                .header(ApiHeaders.TENANT_ID, tenantId)
                .header(ApiHeaders.USER_ID, OPERATOR)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.lines.length()").value(2))
            .andReturn();

        JsonNode entry = objectMapper.readTree(posted.getResponse().getContentAsString());
        printOutput("Entry", entry);
        assertTrue(entry.get("entry_number").asText().startsWith("JE-"));
        assertTrue(entry.get("effective_date").asText().startsWith(calendar.today().toString()));

        mockMvc.perform(get("/api/journal-entries/" + entry.get("id").asText() + "/lines")
                .header(ApiHeaders.TENANT_ID, tenantId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.lines[0].account_id").value(chart.vault.getId().toString()));

        mockMvc.perform(get("/api/accounts/" + chart.memberDeposits.getId() + "/balance")
                .header(ApiHeaders.TENANT_ID, tenantId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(250.0));

        assertTrue(auditLogRepository.findByTenantIdOrderByCreatedAtAsc(tenantId).stream()
            .anyMatch(log -> log.getAction() == AuditAction.JOURNAL_POSTED));
        printSuccess("Journal posted into the open day");
    }

    @Test
    @DisplayName("An unbalanced journal is refused with 422")
    void unbalancedJournal() throws Exception {
        Chart chart = setUpChart(tenantId);
        dayBookService.startDay(tenantId, calendar.today(), OPERATOR);

        mockMvc.perform(post("/api/journal-entries")
                .header(ApiHeaders.TENANT_ID, tenantId)
                .header(ApiHeaders.USER_ID, OPERATOR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\":\"Typo\",\"lines\":["
                    + "{\"account_id\":\"" + chart.vault.getId() + "\",\"debit\":100.00},"
                    + "{\"account_id\":\"" + chart.memberDeposits.getId() + "\",\"credit\":90.00}]}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("DOUBLE_ENTRY_MISMATCH"))
            .andExpect(jsonPath("$.category").value("INVARIANT"));
    }
}
