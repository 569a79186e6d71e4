package com.fintech.checkoutsync.integration;

import com.fintech.checkoutsync.config.ResilienceConfig;
import com.fintech.checkoutsync.dto.ReconciliationResult;
import com.fintech.checkoutsync.dto.VaultedPaymentMethod;
import com.fintech.checkoutsync.entity.Checkout;
import com.fintech.checkoutsync.entity.CheckoutState;
import com.fintech.checkoutsync.entity.Order;
import com.fintech.checkoutsync.entity.Payment;
import com.fintech.checkoutsync.entity.PaymentState;
import com.fintech.checkoutsync.entity.ShipmentState;
import com.fintech.checkoutsync.repository.CheckoutRepository;
import com.fintech.checkoutsync.repository.OrderRepository;
import com.fintech.checkoutsync.repository.PaymentRepository;
import com.fintech.checkoutsync.service.CheckoutFactory;
import com.fintech.checkoutsync.service.MockGatewayStatusClient;
import com.fintech.checkoutsync.service.MockPaymentMethodRegistry;
import com.fintech.checkoutsync.service.ReconciliationService;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for checkout reconciliation.
 * <p>
 * Runs the full scan and recovery flow against H2 and the mock gateway.
 */
@SpringBootTest
@ActiveProfiles("test")
class ReconciliationIntegrationTest {

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private CheckoutFactory checkoutFactory;

    @Autowired
    private CheckoutRepository checkoutRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private MockGatewayStatusClient mockGateway;

    @Autowired
    private MockPaymentMethodRegistry paymentMethodRegistry;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @BeforeEach
    void setUp() {
        paymentRepository.deleteAll();
        checkoutRepository.deleteAll();
        orderRepository.deleteAll();

        mockGateway.clearMockData();
        mockGateway.setSimulateOutage(false);
        circuitBreakerRegistry.circuitBreaker(ResilienceConfig.GATEWAY_CIRCUIT_BREAKER).reset();
    }

    @Test
    @DisplayName("Settled on the gateway: checkout and payment both move, once")
    void shouldSettleCheckoutAndCompletePayment() {
        Order order = createOrder("R-SETTLE", "100.00");
        Checkout checkout = createCheckout("it-settle", CheckoutState.AUTHORIZED, null, LocalDateTime.now());
        Payment payment = createPayment(order, checkout, PaymentState.PENDING, "100.00");
        mockGateway.putTransaction("it-settle", "settled", new BigDecimal("100.00"), "USD");

        ReconciliationResult first = reconciliationService.updateStates();

        assertThat(first.getTotalProcessed()).isEqualTo(1);
        assertThat(first.getChanged()).isEqualTo(1);
        assertThat(first.getErrors()).isZero();
        assertThat(checkoutRepository.findByTransactionId("it-settle").orElseThrow().getState())
                .isEqualTo(CheckoutState.SETTLED);
        Payment afterFirst = paymentRepository.findById(payment.getId()).orElseThrow();
        assertThat(afterFirst.getState()).isEqualTo(PaymentState.COMPLETED);

        // A second run finds nothing open and writes nothing
        ReconciliationResult second = reconciliationService.updateStates();

        assertThat(second.getTotalProcessed()).isZero();
        assertThat(second.getChanged()).isZero();
        assertThat(paymentRepository.findById(payment.getId()).orElseThrow().getVersion())
                .isEqualTo(afterFirst.getVersion());
    }

    @Test
    @DisplayName("Unchanged gateway status is counted but not written")
    void shouldLeaveUnchangedCheckoutAlone() {
        Checkout checkout = createCheckout("it-same", CheckoutState.SETTLING, null, LocalDateTime.now());
        mockGateway.putTransaction("it-same", "settling", new BigDecimal("10.00"), "USD");

        ReconciliationResult result = reconciliationService.updateStates();

        assertThat(result.getUnchanged()).isEqualTo(1);
        assertThat(checkoutRepository.findById(checkout.getId()).orElseThrow().getVersion())
                .isEqualTo(checkout.getVersion());
    }

    @Test
    @DisplayName("Final checkouts are never sent to the gateway")
    void shouldNotProcessFinalCheckouts() {
        createCheckout("it-voided", CheckoutState.VOIDED, null, LocalDateTime.now());
        createCheckout("it-open", CheckoutState.AUTHORIZED, null, LocalDateTime.now());
        mockGateway.putTransaction("it-open", "authorized", new BigDecimal("10.00"), "USD");

        ReconciliationResult result = reconciliationService.updateStates();

        assertThat(result.getTotalProcessed()).isEqualTo(1);
        assertThat(result.getErrors()).isZero();
        assertThat(checkoutRepository.findByTransactionId("it-voided").orElseThrow().getState())
                .isEqualTo(CheckoutState.VOIDED);
    }

    @Test
    @DisplayName("Gateway outage: error recorded, checkout left for the next run")
    void shouldHandleGatewayOutageGracefully() {
        createCheckout("it-outage", CheckoutState.AUTHORIZED, null, LocalDateTime.now());
        mockGateway.putTransaction("it-outage", "settled", new BigDecimal("10.00"), "USD");
        mockGateway.setSimulateOutage(true);

        ReconciliationResult result = reconciliationService.updateStates();

        assertThat(result.getTotalProcessed()).isEqualTo(1);
        assertThat(result.getErrors()).isEqualTo(1);
        assertThat(checkoutRepository.findByTransactionId("it-outage").orElseThrow().getState())
                .isEqualTo(CheckoutState.AUTHORIZED);

        mockGateway.setSimulateOutage(false);
        ReconciliationResult retry = reconciliationService.updateStates();

        assertThat(retry.getChanged()).isEqualTo(1);
    }

    @Test
    @DisplayName("Transactions unknown to the gateway do not open the circuit for the rest of the scan")
    void shouldKeepCircuitClosedForUnknownTransactions() {
        LocalDateTime createdAt = LocalDateTime.now();
        for (int i = 0; i < 12; i++) {
            createCheckout("missing-" + i, CheckoutState.AUTHORIZED, null, createdAt);
        }
        for (int i = 0; i < 10; i++) {
            createCheckout("ok-" + i, CheckoutState.AUTHORIZED, null, createdAt);
            mockGateway.putTransaction("ok-" + i, "settled", new BigDecimal("10.00"), "USD");
        }

        ReconciliationResult result = reconciliationService.updateStates();

        assertThat(result.getTotalProcessed()).isEqualTo(22);
        assertThat(result.getErrors()).isEqualTo(12);
        assertThat(result.getChanged()).isEqualTo(10);
        assertThat(circuitBreakerRegistry.circuitBreaker(ResilienceConfig.GATEWAY_CIRCUIT_BREAKER).getState())
                .isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(checkoutRepository.findByTransactionId("ok-9").orElseThrow().getState())
                .isEqualTo(CheckoutState.SETTLED);
    }

    @Test
    @DisplayName("Failed PayPal payment settled on the gateway with matching amounts is completed")
    void shouldRecoverFailedPaymentWhenAmountsMatch() {
        Order order = createOrder("R-RECOVER", "100.00");
        Checkout checkout = createCheckout("it-recover", CheckoutState.SETTLED, "buyer@example.com",
                LocalDateTime.now().minusHours(3));
        Payment payment = createPayment(order, checkout, PaymentState.FAILED, "100.00");
        mockGateway.putTransaction("it-recover", "settled", new BigDecimal("100"), "USD");

        ReconciliationResult result = reconciliationService.updateStates();

        assertThat(result.getRecoveryCandidates()).isEqualTo(1);
        assertThat(result.getRecoveredCompleted()).isEqualTo(1);
        assertThat(paymentRepository.findById(payment.getId()).orElseThrow().getState())
                .isEqualTo(PaymentState.COMPLETED);
        assertThat(orderRepository.findByNumber("R-RECOVER").orElseThrow().getShipmentState())
                .isEqualTo(ShipmentState.READY);
    }

    @Test
    @DisplayName("Gateway amount differs from order and payment: payment reopened as pending only")
    void shouldLeavePaymentPendingOnAmountMismatch() {
        Order order = createOrder("R-MISMATCH", "100.00");
        Checkout checkout = createCheckout("it-mismatch", CheckoutState.SETTLED, "buyer@example.com",
                LocalDateTime.now().minusHours(3));
        Payment payment = createPayment(order, checkout, PaymentState.FAILED, "100.00");
        mockGateway.putTransaction("it-mismatch", "settled", new BigDecimal("95.00"), "USD");

        ReconciliationResult result = reconciliationService.updateStates();

        assertThat(result.getRecoveredPending()).isEqualTo(1);
        assertThat(result.getRecoveredCompleted()).isZero();
        assertThat(paymentRepository.findById(payment.getId()).orElseThrow().getState())
                .isEqualTo(PaymentState.PENDING);
        assertThat(orderRepository.findByNumber("R-MISMATCH").orElseThrow().getShipmentState())
                .isEqualTo(ShipmentState.PENDING);
    }

    @Test
    @DisplayName("Checkouts older than the recovery window are left alone")
    void shouldIgnoreCheckoutsOutsideRecoveryWindow() {
        Order order = createOrder("R-OLD", "100.00");
        Checkout checkout = createCheckout("it-old", CheckoutState.SETTLED, "buyer@example.com",
                LocalDateTime.now().minusHours(72));
        Payment payment = createPayment(order, checkout, PaymentState.FAILED, "100.00");
        mockGateway.putTransaction("it-old", "settled", new BigDecimal("100.00"), "USD");

        ReconciliationResult result = reconciliationService.updateStates();

        assertThat(result.getRecoveryCandidates()).isZero();
        assertThat(paymentRepository.findById(payment.getId()).orElseThrow().getState())
                .isEqualTo(PaymentState.FAILED);
    }

    @Test
    @DisplayName("Checkout created from a vaulted card is picked up once it has a transaction")
    void shouldReconcileCheckoutCreatedFromVault() {
        paymentMethodRegistry.putVaultedPaymentMethod("it-token", VaultedPaymentMethod.builder()
                .cardType("MasterCard").last4("4444").build());

        Checkout checkout = checkoutFactory.createFromToken("it-token",
                MockPaymentMethodRegistry.DEFAULT_PAYMENT_METHOD_ID);
        assertThat(checkout.getBraintreeCardType()).isEqualTo("master");

        // Without a transaction the checkout is not scanned
        assertThat(reconciliationService.updateStates().getTotalProcessed()).isZero();

        checkout.recordTransaction("it-vault", CheckoutState.AUTHORIZING);
        checkoutRepository.save(checkout);
        mockGateway.putTransaction("it-vault", "authorized", new BigDecimal("20.00"), "USD");

        ReconciliationResult result = reconciliationService.updateStates();

        assertThat(result.getChanged()).isEqualTo(1);
        assertThat(checkoutRepository.findByTransactionId("it-vault").orElseThrow().getState())
                .isEqualTo(CheckoutState.AUTHORIZED);
    }

    @Test
    @DisplayName("Statistics should reflect current state")
    void statisticsShouldReflectCurrentState() {
        Order order = createOrder("R-STATS", "50.00");
        createCheckout("it-s1", CheckoutState.AUTHORIZED, null, LocalDateTime.now());
        Checkout settled = createCheckout("it-s2", CheckoutState.SETTLED, null, LocalDateTime.now());
        createPayment(order, settled, PaymentState.COMPLETED, "50.00");

        var stats = reconciliationService.getStats();

        assertThat(stats.getOpenCheckoutCount()).isEqualTo(1);
        assertThat(stats.getSettledCheckoutCount()).isEqualTo(1);
        assertThat(stats.getCompletedPaymentCount()).isEqualTo(1);
        assertThat(stats.getFailedPaymentCount()).isZero();
    }

    private Order createOrder(String number, String total) {
        return orderRepository.save(Order.builder()
                .number(number)
                .total(new BigDecimal(total))
                .currency("USD")
                .build());
    }

    private Checkout createCheckout(String transactionId, CheckoutState state, String paypalEmail,
                                    LocalDateTime createdAt) {
        return checkoutRepository.save(Checkout.builder()
                .state(state)
                .transactionId(transactionId)
                .paypalEmail(paypalEmail)
                .braintreeCardType(paypalEmail == null ? "visa" : "")
                .createdAt(createdAt)
                .build());
    }

    private Payment createPayment(Order order, Checkout checkout, PaymentState state, String amount) {
        return paymentRepository.save(Payment.builder()
                .order(order)
                .checkoutId(checkout.getId())
                .state(state)
                .amount(new BigDecimal(amount))
                .build());
    }
}
