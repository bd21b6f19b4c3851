package com.purchasingpower.bookflow.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.bookflow.client.ChatMessage;
import com.purchasingpower.bookflow.client.ProviderResult;
import com.purchasingpower.bookflow.configuration.BookFlowProperties;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.service.GenerativeTextService;
import com.purchasingpower.bookflow.service.NaturalResponseService;
import com.purchasingpower.bookflow.service.ResponseTemplates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class NaturalResponseServiceImpl implements NaturalResponseService {

    private static final String PROMPT = """
            Eres un asistente amigable de una libreria online. Responde en espanol de forma natural y util.

            REGLAS IMPORTANTES:
            - SIEMPRE incluye los datos concretos del resultado (titulos, autores, precios, cantidades, estados, etc.)
            - Si hay una lista de libros, menciona cada uno con su titulo, autor y precio
            - Si es un detalle de libro, incluye titulo, autor, genero, precio, stock y descripcion
            - Si es stock, di cuantas unidades hay disponibles
            - Si es una orden, incluye el numero de orden, estado y total
            - Si hay un error en el resultado, explicalo amablemente
            - Se conciso pero COMPLETO con la informacion
            - NO digas solo "aqui estan los detalles" sin mostrarlos

            Accion realizada: %s
            Datos del resultado: %s
            Consulta original del usuario: %s

            Responde de forma natural incluyendo TODOS los datos relevantes:""";

    private final GenerativeTextService generativeTextService;
    private final ResponseTemplates templates;
    private final BookFlowProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public String render(ActionType action, Map<String, Object> payload, String query) {
        if (action.isTransactional()) {
            return templates.forDirect(action, payload);
        }

        String resultJson;
        try {
            resultJson = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Could not serialize {} result, using template: {}", action.getFunctionName(), e.getMessage());
            return templates.forDirect(action, payload);
        }

        String prompt = String.format(PROMPT, action.getFunctionName(), resultJson, query == null ? "" : query);
        ProviderResult<String> result = generativeTextService.complete(
                List.of(ChatMessage.user(prompt)),
                properties.getLlm().getResponseTemperature(),
                properties.getLlm().getResponseMaxTokens());

        String text = result.getValue().map(String::trim).orElse("");
        if (text.isEmpty()) {
            log.info("⚠️ Generative reply unavailable for {} ({}), using template",
                    action.getFunctionName(), result.isSuccess() ? "empty" : result.getFailureKind());
            return templates.forDirect(action, payload);
        }
        return text;
    }
}
