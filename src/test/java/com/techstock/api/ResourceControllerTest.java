package com.techstock.api;

import com.techstock.domain.exception.AlreadyExistsException;
import com.techstock.domain.exception.BusinessRuleViolationException;
import com.techstock.domain.exception.DatabaseException;
import com.techstock.domain.exception.NotFoundException;
import com.techstock.domain.model.PagedResult;
import com.techstock.domain.model.Pagination;
import com.techstock.domain.model.PaginationParams;
import com.techstock.domain.model.ResourceFilters;
import com.techstock.domain.model.ResourceView;
import com.techstock.domain.model.SortDirection;
import com.techstock.domain.model.SortParams;
import com.techstock.domain.service.DashboardService;
import com.techstock.domain.service.ResourceService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP mapping of the resource endpoints and of catalog errors.
 */
@WebMvcTest(ResourceController.class)
class ResourceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResourceService resourceService;

    @MockBean
    private DashboardService dashboardService;

    @Test
    void testListResources_PassesParameters() throws Exception {
        // Given
        ResourceView vm = ResourceView.builder().id(1L).name("vm1").build();
        when(resourceService.listResources(any(), any(), any()))
                .thenReturn(new PagedResult<>(List.of(vm), Pagination.of(2, 10, 11)));

        // When / Then
        mockMvc.perform(get("/api/v1/resources")
                        .param("page", "2")
                        .param("size", "10")
                        .param("tags", "Env:prod")
                        .param("sortField", "name")
                        .param("sortDirection", "DESC"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].name").value("vm1"))
                .andExpect(jsonPath("$.pagination.total").value(11))
                .andExpect(jsonPath("$.pagination.totalPages").value(2));

        ArgumentCaptor<ResourceFilters> filters = ArgumentCaptor.forClass(ResourceFilters.class);
        ArgumentCaptor<SortParams> sort = ArgumentCaptor.forClass(SortParams.class);
        ArgumentCaptor<PaginationParams> pagination = ArgumentCaptor.forClass(PaginationParams.class);
        verify(resourceService).listResources(filters.capture(), sort.capture(), pagination.capture());
        assertEquals("Env:prod", filters.getValue().getTags());
        assertEquals(SortDirection.DESC, sort.getValue().getDirection());
        assertEquals(10, pagination.getValue().getSize());
    }

    @Test
    void testNotFound() throws Exception {
        when(resourceService.getResource(42L)).thenThrow(new NotFoundException("Resource", 42L));

        mockMvc.perform(get("/api/v1/resources/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.error").value("Entity not found: Resource with id 42"));
    }

    @Test
    void testAlreadyExistsAndBusinessRule() throws Exception {
        doThrow(new BusinessRuleViolationException("Resource group 2 does not belong to subscription 1"))
                .when(resourceService).deleteResource(1L);
        when(resourceService.getResource(2L)).thenThrow(new AlreadyExistsException("Resource", "externalId", "x"));

        mockMvc.perform(delete("/api/v1/resources/1"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value(422));
        mockMvc.perform(get("/api/v1/resources/2"))
                .andExpect(status().isConflict());
    }

    @Test
    void testDatabaseErrorHidesDetail() throws Exception {
        when(resourceService.getResource(1L)).thenThrow(
                new DatabaseException("relation \"resource\" does not exist", new SQLException("boom")));
        when(resourceService.getResourceTypes()).thenThrow(
                new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(get("/api/v1/resources/1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Database error occurred"))
                .andExpect(jsonPath("$.status").value(500));
        mockMvc.perform(get("/api/v1/resources/types"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Database error occurred"));
    }

    @Test
    void testValidationFailure() throws Exception {
        mockMvc.perform(post("/api/v1/resources")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\",\"resourceType\":\"vm\",\"location\":\"eastus\","
                                + "\"subscriptionId\":1,\"resourceGroupId\":2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verify(resourceService, never()).createResource(any());
    }

    @Test
    void testMalformedIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/resources/abc"))
                .andExpect(status().isBadRequest());
    }
}
