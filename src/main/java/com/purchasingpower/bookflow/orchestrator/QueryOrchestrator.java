package com.purchasingpower.bookflow.orchestrator;

import com.purchasingpower.bookflow.entity.BookCard;
import com.purchasingpower.bookflow.entity.EntityResolution;
import com.purchasingpower.bookflow.entity.ResolutionStatus;
import com.purchasingpower.bookflow.flow.ActionFlowEngine;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.flow.FlowState;
import com.purchasingpower.bookflow.intent.IntentMatch;
import com.purchasingpower.bookflow.intent.IntentResolver;
import com.purchasingpower.bookflow.intent.ResolutionMethod;
import com.purchasingpower.bookflow.service.AuditLogService;
import com.purchasingpower.bookflow.service.NaturalResponseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Entry point for one user query.
 *
 * <ol>
 *   <li>greetings and help get canned replies</li>
 *   <li>the intent resolver picks an action, or asks for clarification</li>
 *   <li>unclassified queries outside the bookstore domain are refused</li>
 *   <li>parameters are extracted; unclear book references are answered here</li>
 *   <li>flow actions run through the {@link ActionFlowEngine}, the rest directly</li>
 * </ol>
 * Exactly one audit record is written per query, failures included.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryOrchestrator {

    static final String CLARIFICATION_REPLY = """
            No estoy seguro de entender tu solicitud. Puedo ayudarte con:

            - Buscar libros por género, autor o tema
            - Recomendaciones personalizadas
            - Ver detalles de un libro
            - Verificar stock/disponibilidad
            - Agregar o quitar libros del carrito
            - Hacer checkout y pagar
            - Consultar estado de pedidos

            ¿Qué te gustaría hacer?""";

    static final String BOOK_NOT_FOUND_REPLY =
            "No encontré ningún libro con ese nombre. ¿Podrías darme más detalles o el nombre exacto?";

    private final ConversationShortcuts shortcuts;
    private final IntentResolver intentResolver;
    private final DomainGuardrail domainGuardrail;
    private final ParameterExtractor parameterExtractor;
    private final ActionFlowEngine flowEngine;
    private final DirectActionExecutor directActionExecutor;
    private final NaturalResponseService naturalResponseService;
    private final AuditLogService auditLogService;

    public OrchestratorResult handle(String query, Long userId, Long sessionId) {
        log.info("🔵 Query from user {}: '{}'", userId, query);
        OrchestratorResult result;
        try {
            result = process(query, userId);
        } catch (RuntimeException e) {
            log.error("🔴 Query from user {} failed: {}", userId, e.getMessage(), e);
            auditLogService.record(userId, sessionId, query, OrchestratorResult.builder()
                    .response("ERROR: " + e.getMessage())
                    .build());
            throw e;
        }
        auditLogService.record(userId, sessionId, query, result);
        log.info("🟢 Answered user {} via {} ({})", userId, result.getMethod().label(), result.getFunctionName());
        return result;
    }

    private OrchestratorResult process(String query, Long userId) {
        Optional<String> shortcut = shortcuts.reply(query);
        if (shortcut.isPresent()) {
            return OrchestratorResult.builder()
                    .response(shortcut.get())
                    .method(ResolutionMethod.HELP)
                    .similarity(1.0)
                    .build();
        }

        IntentMatch match = intentResolver.resolve(query);
        if (!match.isResolved()) {
            return unresolved(query, match);
        }

        ActionType action = match.getAction();
        log.info("Action selected: {} (method: {})", action.getFunctionName(), match.getMethod().label());
        ParameterExtraction extraction = parameterExtractor.extract(action, query);

        if (action.isFlowBased()) {
            if (action.mutatesCart() && extraction.getParams().getBookId() == null) {
                Optional<OrchestratorResult> unclear = unclearBook(extraction.getBookResolution(), match);
                if (unclear.isPresent()) {
                    return unclear.get();
                }
            }
            FlowState flow = flowEngine.run(action, userId, query, extraction.getParams());
            return OrchestratorResult.builder()
                    .response(flow.getResponse())
                    .action(action)
                    .method(match.getMethod())
                    .similarity(match.getConfidence())
                    .stateTrace(flow.traceNames())
                    .candidates(match.getCandidates())
                    .build();
        }

        DirectResult direct = directActionExecutor.execute(action, query, userId, extraction);
        String response = naturalResponseService.render(action, direct.getPayload(), query);
        return OrchestratorResult.builder()
                .response(response)
                .action(action)
                .method(match.getMethod())
                .similarity(match.getConfidence())
                .books(direct.getBooks())
                .candidates(match.getCandidates())
                .build();
    }

    private OrchestratorResult unresolved(String query, IntentMatch match) {
        if (!domainGuardrail.isRelevant(query)) {
            log.info("⚠️ Query outside the bookstore domain");
            return OrchestratorResult.builder()
                    .response(domainGuardrail.refusal())
                    .method(ResolutionMethod.GUARDRAIL)
                    .similarity(match.getConfidence())
                    .candidates(match.getCandidates())
                    .build();
        }
        return OrchestratorResult.builder()
                .response(CLARIFICATION_REPLY)
                .method(ResolutionMethod.CLARIFICATION)
                .similarity(match.getConfidence())
                .candidates(match.getCandidates())
                .build();
    }

    private Optional<OrchestratorResult> unclearBook(EntityResolution resolution, IntentMatch match) {
        if (resolution == null || resolution.isFound()) {
            return Optional.empty();
        }

        OrchestratorResult.OrchestratorResultBuilder result = OrchestratorResult.builder()
                .action(match.getAction())
                .method(match.getMethod())
                .similarity(match.getConfidence())
                .candidates(match.getCandidates());

        if (resolution.getStatus() == ResolutionStatus.AMBIGUOUS) {
            List<BookCard> options = resolution.getCandidates();
            String titles = IntStream.range(0, options.size())
                    .mapToObj(i -> "  " + (i + 1) + ") " + options.get(i).getTitle() + " — " + options.get(i).getAuthor())
                    .collect(Collectors.joining("\n"));
            return Optional.of(result
                    .response("Encontré varios libros que coinciden. ¿Te refieres a alguno de estos?\n\n"
                            + titles + "\n\nDime el número o nombre del libro.")
                    .books(options)
                    .build());
        }
        return Optional.of(result.response(BOOK_NOT_FOUND_REPLY).build());
    }
}
