package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.model.IdempotencyKey;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.SetupStep;
import com.ryuqq.orgsetup.core.spi.SetupObserver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;

/**
 * CompositeSetupObserver 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CompositeSetupObserverTest {

    @Mock
    private SetupObserver first;

    @Mock
    private SetupObserver second;

    private final RequestContext context = RequestContext.start(IdempotencyKey.of("idem-composite-001"), null);

    @Test
    void 모든_Observer에_등록_순서대로_전달() {
        // given
        CompositeSetupObserver composite = CompositeSetupObserver.of(first, second);

        // when
        composite.onStepStarted(context, SetupStep.TENANT_CREATION);

        // then
        InOrder order = inOrder(first, second);
        order.verify(first).onStepStarted(context, SetupStep.TENANT_CREATION);
        order.verify(second).onStepStarted(context, SetupStep.TENANT_CREATION);
    }

    @Test
    void 한_Observer가_실패해도_나머지에_전달() {
        // given
        doThrow(new IllegalStateException("broken")).when(first).onSetupStarted(context);
        CompositeSetupObserver composite = CompositeSetupObserver.of(first, second);

        // when & then
        assertThatCode(() -> composite.onSetupStarted(context)).doesNotThrowAnyException();
        verify(second).onSetupStarted(context);
    }

    @Test
    void null_Observer는_거부() {
        assertThatThrownBy(() -> new CompositeSetupObserver(Arrays.asList(first, null)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CompositeSetupObserver(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
