package com.ryuqq.classdrop.core.model;

import com.ryuqq.classdrop.core.statemachine.BatchState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchProgress 테스트.
 *
 * @author ClassDrop Team
 * @since 1.0.0
 */
class BatchProgressTest {

    @Test
    void started_카운트는_0이고_active이다() {
        BatchProgress progress = BatchProgress.started("Physics", 4, 1000L);

        assertThat(progress.total()).isEqualTo(4);
        assertThat(progress.completed()).isZero();
        assertThat(progress.failed()).isZero();
        assertThat(progress.active()).isTrue();
        assertThat(progress.state()).isEqualTo(BatchState.RUNNING);
    }

    @Test
    void 일부_실패해도_COMPLETED로_종료된다() {
        BatchProgress progress = BatchProgress.started("Physics", 4, 1000L)
            .withCompleted()
            .withCompleted()
            .withCompleted()
            .withFailed()
            .finish(BatchState.COMPLETED, 2000L);

        assertThat(progress.active()).isFalse();
        assertThat(progress.state()).isEqualTo(BatchState.COMPLETED);
        assertThat(progress.hasFailures()).isTrue();
        assertThat(progress.settled()).isEqualTo(4);
        assertThat(progress.percent()).isEqualTo(100);
        assertThat(progress.finishedAt()).isEqualTo(2000L);
    }

    @Test
    void finish_종료_상태가_아니면_거부된다() {
        BatchProgress progress = BatchProgress.started("Physics", 1, 0L);

        assertThatThrownBy(() -> progress.finish(BatchState.RUNNING, 1L))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void idle_진행률은_0이다() {
        assertThat(BatchProgress.idle().percent()).isZero();
        assertThat(BatchProgress.idle().active()).isFalse();
    }
}
