package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.JobPriority;
import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.exception.InvalidStateException;
import com.example.jobscheduler.exception.JobValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Job Entity Tests")
class JobTest {

    private Job job;

    @BeforeEach
    void setUp() {
        job = Job.create("nightly-report", "Builds the nightly report", "http-callback", null, null, "alice");
    }

    @Nested
    @DisplayName("create Tests")
    class CreateTests {

        @Test
        @DisplayName("Should start in DRAFT with default parameters and priority")
        void shouldStartInDraftWithDefaults() {
            assertThat(job.getStatus()).isEqualTo(JobStatus.DRAFT);
            assertThat(job.getParameters()).isEqualTo("{}");
            assertThat(job.getPriority()).isEqualTo(JobPriority.DEFAULT);
            assertThat(job.getCreatedBy()).isEqualTo("alice");
            assertThat(job.getCreatedAt()).isNotNull();
        }

        @Test
        @DisplayName("Should reject blank name")
        void shouldRejectBlankName() {
            assertThatThrownBy(() -> Job.create("  ", null, "http-callback", null, null, "alice"))
                    .isInstanceOf(JobValidationException.class)
                    .extracting("field").isEqualTo("name");
        }

        @Test
        @DisplayName("Should reject missing handler type")
        void shouldRejectMissingHandlerType() {
            assertThatThrownBy(() -> Job.create("job", null, null, null, null, "alice"))
                    .isInstanceOf(JobValidationException.class)
                    .extracting("field").isEqualTo("handlerType");
        }
    }

    @Nested
    @DisplayName("Status Transition Tests")
    class TransitionTests {

        @Test
        @DisplayName("Should move DRAFT -> ACTIVE -> PAUSED -> ACTIVE")
        void shouldToggleBetweenActiveAndPaused() {
            job.activate("bob");
            assertThat(job.isActive()).isTrue();

            job.pause("bob");
            assertThat(job.getStatus()).isEqualTo(JobStatus.PAUSED);

            job.activate("bob");
            assertThat(job.getStatus()).isEqualTo(JobStatus.ACTIVE);
            assertThat(job.getUpdatedBy()).isEqualTo("bob");
        }

        @Test
        @DisplayName("Should accept activating an already active job")
        void shouldAcceptReactivation() {
            job.activate("bob");
            job.activate("carol");

            assertThat(job.getStatus()).isEqualTo(JobStatus.ACTIVE);
            assertThat(job.getUpdatedBy()).isEqualTo("carol");
        }

        @Test
        @DisplayName("Should not pause a DRAFT job")
        void shouldNotPauseDraft() {
            assertThatThrownBy(() -> job.pause("bob"))
                    .isInstanceOf(InvalidStateException.class)
                    .hasMessageContaining("pause");
        }

        @Test
        @DisplayName("Should treat DELETED as terminal")
        void shouldTreatDeletedAsTerminal() {
            job.delete("bob");

            assertThat(job.getStatus()).isEqualTo(JobStatus.DELETED);
            assertThatThrownBy(() -> job.delete("bob")).isInstanceOf(InvalidStateException.class);
            assertThatThrownBy(() -> job.activate("bob")).isInstanceOf(InvalidStateException.class);
            assertThatThrownBy(() -> job.pause("bob")).isInstanceOf(InvalidStateException.class);
            assertThat(job.getStatus()).isEqualTo(JobStatus.DELETED);
        }
    }

    @Nested
    @DisplayName("update Tests")
    class UpdateTests {

        @Test
        @DisplayName("Should keep priority when none is given")
        void shouldKeepPriorityWhenNull() {
            job.update("renamed", "desc", "execution-log-archive", "{\"retentionDays\":7}", null, "bob");

            assertThat(job.getName()).isEqualTo("renamed");
            assertThat(job.getHandlerType()).isEqualTo("execution-log-archive");
            assertThat(job.getParameters()).isEqualTo("{\"retentionDays\":7}");
            assertThat(job.getPriority()).isEqualTo(JobPriority.DEFAULT);
        }

        @Test
        @DisplayName("Should change priority when given")
        void shouldChangePriority() {
            job.update("renamed", null, "http-callback", null, JobPriority.CRITICAL, "bob");

            assertThat(job.getPriority()).isEqualTo(JobPriority.CRITICAL);
            assertThat(job.getParameters()).isEqualTo("{}");
        }

        @Test
        @DisplayName("Should reject update of a deleted job")
        void shouldRejectUpdateOfDeletedJob() {
            job.delete("bob");

            assertThatThrownBy(() -> job.update("x", null, "http-callback", null, null, "bob"))
                    .isInstanceOf(InvalidStateException.class);
        }
    }
}
