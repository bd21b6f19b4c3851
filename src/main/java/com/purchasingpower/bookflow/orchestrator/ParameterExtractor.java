package com.purchasingpower.bookflow.orchestrator;

import com.purchasingpower.bookflow.entity.BookResolver;
import com.purchasingpower.bookflow.entity.EntityResolution;
import com.purchasingpower.bookflow.entity.NumberContext;
import com.purchasingpower.bookflow.entity.NumberExtractor;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.flow.FlowParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ParameterExtractor {

    private final BookResolver bookResolver;
    private final NumberExtractor numberExtractor;

    public ParameterExtraction extract(ActionType action, String query) {
        FlowParams.FlowParamsBuilder params = FlowParams.builder();
        EntityResolution resolution = null;

        if (action.referencesBook()) {
            resolution = bookResolver.resolve(query);
            if (resolution.isFound()) {
                params.bookId(resolution.getBook().getId());
                log.info("📖 Book identified: {} (ID: {})", resolution.getBook().getTitle(), resolution.getBook().getId());
            }
        }

        if (action == ActionType.ADD_BOOK_TO_CART) {
            numberExtractor.extract(query, NumberContext.QUANTITY).ifPresent(params::quantity);
        }

        if (action.referencesOrder()) {
            numberExtractor.extract(query, NumberContext.ORDER_ID)
                    .ifPresent(id -> params.orderId(id.longValue()));
        }

        return new ParameterExtraction(params.build(), resolution);
    }
}
