package com.purchasingpower.bookflow.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.bookflow.client.FailureKind;
import com.purchasingpower.bookflow.client.ProviderResult;
import com.purchasingpower.bookflow.configuration.BookFlowProperties;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.service.GenerativeTextService;
import com.purchasingpower.bookflow.service.ResponseTemplates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NaturalResponseServiceImplTest {

    private static final Map<String, Object> STOCK = Map.of("book_id", 1, "title", "Dune", "stock", 4);

    @Mock
    private GenerativeTextService generativeTextService;

    private NaturalResponseServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new NaturalResponseServiceImpl(
                generativeTextService, new ResponseTemplates(), new BookFlowProperties(), new ObjectMapper());
    }

    @Test
    void generatedText_shouldBeUsed() {
        when(generativeTextService.complete(anyList(), anyDouble(), anyInt()))
                .thenReturn(ProviderResult.success("  Quedan 4 ejemplares de Dune.  "));

        assertThat(service.render(ActionType.CHECK_BOOK_STOCK, STOCK, "hay stock de dune"))
                .isEqualTo("Quedan 4 ejemplares de Dune.");
    }

    @Test
    void providerFailure_shouldFallBackToTemplate() {
        when(generativeTextService.complete(anyList(), anyDouble(), anyInt()))
                .thenReturn(ProviderResult.failure(FailureKind.UNAVAILABLE, "offline"));

        assertThat(service.render(ActionType.CHECK_BOOK_STOCK, STOCK, "hay stock de dune"))
                .isEqualTo("Dune tiene 4 unidades disponibles.");
    }

    @Test
    void blankText_shouldFallBackToTemplate() {
        when(generativeTextService.complete(anyList(), anyDouble(), anyInt()))
                .thenReturn(ProviderResult.success("   "));

        assertThat(service.render(ActionType.CHECK_BOOK_STOCK, STOCK, null))
                .isEqualTo("Dune tiene 4 unidades disponibles.");
    }

    @Test
    void viewCart_shouldNeverCallProvider() {
        String reply = service.render(ActionType.VIEW_CART, Map.of("items", List.of(), "total", 0.0), "mi carrito");

        assertThat(reply).startsWith("Tu carrito está vacío.");
        verifyNoInteractions(generativeTextService);
    }
}
