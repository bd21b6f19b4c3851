package com.purchasingpower.bookflow.intent;

import com.purchasingpower.bookflow.configuration.IntentRuleProperties;
import com.purchasingpower.bookflow.flow.ActionType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Runs the shipped intent-rules.yml against typical Spanish queries.
 */
@DisplayName("Rule Matcher Tests")
class RuleMatcherTest {

    private static RuleMatcher ruleMatcher;

    @BeforeAll
    static void loadRules() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("intent-rules", new ClassPathResource("intent-rules.yml"));
        StandardEnvironment environment = new StandardEnvironment();
        sources.forEach(environment.getPropertySources()::addLast);

        IntentRuleProperties properties = Binder.get(environment)
                .bind("bookflow.intent", IntentRuleProperties.class)
                .get();
        ruleMatcher = new RuleMatcher(properties);
    }

    @Test
    @DisplayName("View-cart rule wins over the broad add-to-cart patterns")
    void viewCart_shouldBeCheckedBeforeAddToCart() {
        assertThat(ruleMatcher.match("ver mi carrito")).contains(ActionType.VIEW_CART);
        assertThat(ruleMatcher.match("¿Qué tengo en mi carrito?")).contains(ActionType.VIEW_CART);
    }

    @Test
    void confirmation_shouldMapToConfirmPayment() {
        assertThat(ruleMatcher.match("sí, confirmo el pago")).contains(ActionType.CONFIRM_PAYMENT);
        assertThat(ruleMatcher.match("Si confirmo")).contains(ActionType.CONFIRM_PAYMENT);
    }

    @Test
    void purchaseWithQuantity_shouldMapToAddToCart() {
        assertThat(ruleMatcher.match("compra 2 Dune")).contains(ActionType.ADD_BOOK_TO_CART);
        assertThat(ruleMatcher.match("agrega El Hobbit al carrito")).contains(ActionType.ADD_BOOK_TO_CART);
    }

    @Test
    void orderQueries_shouldMapToOrderActions() {
        assertThat(ruleMatcher.match("pagar orden #7")).contains(ActionType.PROCESS_PAYMENT);
        assertThat(ruleMatcher.match("cancelar mi pedido 3")).contains(ActionType.CANCEL_ORDER);
        assertThat(ruleMatcher.match("hacer checkout")).contains(ActionType.CHECKOUT_ORDER);
    }

    @Test
    void catalogQueries_shouldMapToReadActions() {
        assertThat(ruleMatcher.match("busco libros de terror")).contains(ActionType.SEARCH_BOOKS_FOR_SALE);
        assertThat(ruleMatcher.match("qué me recomiendas")).contains(ActionType.RECOMMEND_BOOKS_FOR_PURCHASE);
    }

    @Test
    void unrelatedQuery_shouldNotMatch() {
        assertThat(ruleMatcher.match("el clima de mañana en madrid")).isEmpty();
        assertThat(ruleMatcher.match("   ")).isEmpty();
        assertThat(ruleMatcher.match(null)).isEmpty();
    }

    @Test
    void ruleWithoutAction_shouldFailAtStartup() {
        IntentRuleProperties properties = new IntentRuleProperties();
        IntentRuleProperties.Rule rule = new IntentRuleProperties.Rule();
        rule.setPatterns(List.of("carrito"));
        properties.setRules(List.of(rule));

        assertThrows(IllegalStateException.class, () -> new RuleMatcher(properties));
    }
}
