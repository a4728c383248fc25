package com.baykanat.insider.warehouse.domain.catalog;

import java.time.Duration;
import java.util.List;

/** Yerleşik aggregate view'lar ve dashboard sorguları (öğrenci ilerlemesi, sınıf performansı, öğretmen yükü, sıralamalar). */
public final class AnalyticsCatalog {

    public static final String STUDENT_GRADE_SUMMARY = "student_grade_summary";
    public static final String CLASS_PROGRESS_SUMMARY = "class_progress_summary";
    public static final String TEACHER_WORKLOAD = "teacher_workload";
    public static final String SUBJECT_PERFORMANCE = "subject_performance";

    /** İstatistik job'unun satır sayısını izlediği kaynak tablolar. */
    public static final List<String> SOURCE_TABLES = List.of(
            "assignments_assignmentsubmission", "assignments_assignment", "materials_subject", "accounts_user");

    private static final ParameterSpec DAYS_BACK_30 = daysBack(30);
    private static final ParameterSpec DAYS_BACK_90 = daysBack(90);
    private static final ParameterSpec SUBJECT_FILTER = ParameterSpec.optional("subject_id", ParameterType.LONG);
    private static final ParameterSpec GRANULARITY = ParameterSpec.builder()
            .name("granularity").type(ParameterType.STRING).defaultValue("week")
            .allowedValue("day").allowedValue("week").allowedValue("month")
            .build();
    private static final ParameterSpec MIN_SUBMISSIONS = ParameterSpec.builder()
            .name("min_submissions").type(ParameterType.INTEGER).defaultValue(3).min(1L).max(1000L)
            .build();

    private AnalyticsCatalog() {
    }

    public static List<AggregateViewDefinition> views() {
        return List.of(
                AggregateViewDefinition.builder()
                        .name(STUDENT_GRADE_SUMMARY)
                        .description("Per student and subject grade summary")
                        .refreshStatement("""
                                SELECT s.student_id,
                                       a.subject_id,
                                       subj.name AS subject_name,
                                       COUNT(*) AS submissions_count,
                                       COUNT(*) FILTER (WHERE s.status = 'graded') AS graded_count,
                                       ROUND(AVG(s.score * 100.0 / NULLIF(s.max_score, 0))
                                             FILTER (WHERE s.status = 'graded'), 2) AS avg_score_pct,
                                       ROUND(MAX(s.score * 100.0 / NULLIF(s.max_score, 0))
                                             FILTER (WHERE s.status = 'graded'), 2) AS best_score_pct,
                                       MAX(s.submitted_at) AS last_submitted_at
                                FROM assignments_assignmentsubmission s
                                JOIN assignments_assignment a ON a.id = s.assignment_id
                                JOIN materials_subject subj ON subj.id = a.subject_id
                                GROUP BY s.student_id, a.subject_id, subj.name
                                """)
                        .indexColumn("student_id")
                        .indexColumn("subject_id")
                        .build(),
                AggregateViewDefinition.builder()
                        .name(CLASS_PROGRESS_SUMMARY)
                        .description("Per subject weekly progress")
                        .refreshStatement("""
                                SELECT a.subject_id,
                                       DATE_TRUNC('week', s.submitted_at) AS period_start,
                                       COUNT(DISTINCT s.student_id) AS active_students,
                                       COUNT(*) AS submissions_count,
                                       COUNT(*) FILTER (WHERE s.status = 'graded') AS graded_count,
                                       ROUND(AVG(s.score * 100.0 / NULLIF(s.max_score, 0))
                                             FILTER (WHERE s.status = 'graded'), 2) AS avg_score_pct
                                FROM assignments_assignmentsubmission s
                                JOIN assignments_assignment a ON a.id = s.assignment_id
                                WHERE s.submitted_at IS NOT NULL
                                GROUP BY a.subject_id, DATE_TRUNC('week', s.submitted_at)
                                """)
                        .indexColumn("subject_id")
                        .indexColumn("period_start")
                        .build(),
                AggregateViewDefinition.builder()
                        .name(TEACHER_WORKLOAD)
                        .description("Per teacher review and grading workload")
                        .refreshStatement("""
                                SELECT a.author_id AS teacher_id,
                                       COUNT(DISTINCT a.id) AS total_assignments,
                                       COUNT(s.id) AS total_submissions,
                                       COUNT(s.id) FILTER (WHERE s.status = 'submitted') AS pending_reviews,
                                       COUNT(s.id) FILTER (WHERE s.status = 'submitted'
                                                           AND s.submitted_at < NOW() - INTERVAL '7 days') AS overdue_reviews,
                                       ROUND(CAST(AVG(EXTRACT(EPOCH FROM (s.graded_at - s.submitted_at)) / 3600.0)
                                             FILTER (WHERE s.graded_at IS NOT NULL) AS NUMERIC), 2) AS avg_grade_time_hours
                                FROM assignments_assignment a
                                LEFT JOIN assignments_assignmentsubmission s ON s.assignment_id = a.id
                                GROUP BY a.author_id
                                """)
                        .indexColumn("teacher_id")
                        .build(),
                AggregateViewDefinition.builder()
                        .name(SUBJECT_PERFORMANCE)
                        .description("Per subject student ranking by graded score")
                        .refreshStatement("""
                                SELECT a.subject_id,
                                       s.student_id,
                                       COUNT(*) AS submissions_count,
                                       ROUND(AVG(s.score * 100.0 / NULLIF(s.max_score, 0)), 2) AS avg_score_pct,
                                       RANK() OVER (PARTITION BY a.subject_id
                                                    ORDER BY AVG(s.score * 100.0 / NULLIF(s.max_score, 0)) DESC NULLS LAST)
                                           AS rank_in_subject,
                                       ROUND(CAST(PERCENT_RANK() OVER (PARTITION BY a.subject_id
                                                    ORDER BY AVG(s.score * 100.0 / NULLIF(s.max_score, 0)) ASC NULLS FIRST)
                                                  * 100 AS NUMERIC), 1) AS percentile
                                FROM assignments_assignmentsubmission s
                                JOIN assignments_assignment a ON a.id = s.assignment_id
                                WHERE s.status = 'graded'
                                GROUP BY a.subject_id, s.student_id
                                """)
                        .indexColumn("subject_id")
                        .indexColumn("student_id")
                        .build());
    }

    public static List<QueryDefinition> queries() {
        return List.of(
                QueryDefinition.builder()
                        .name("student_progress")
                        .description("Grade summary of one student per subject")
                        .target(QueryTarget.view(STUDENT_GRADE_SUMMARY))
                        .sql("""
                                SELECT student_id, subject_id, subject_name, submissions_count, graded_count,
                                       avg_score_pct, best_score_pct, last_submitted_at
                                FROM student_grade_summary
                                WHERE student_id = :student_id
                                  AND (CAST(:subject_id AS BIGINT) IS NULL OR subject_id = :subject_id)
                                ORDER BY subject_name, subject_id
                                """)
                        .parameterSchema(ParameterSchema.of(
                                ParameterSpec.required("student_id", ParameterType.LONG),
                                SUBJECT_FILTER))
                        .defaultLimit(100)
                        .maxLimit(1000)
                        .build(),
                QueryDefinition.builder()
                        .name("subject_performance_comparison")
                        .description("One student's standing across subjects")
                        .target(QueryTarget.view(SUBJECT_PERFORMANCE))
                        .sql("""
                                SELECT subject_id, submissions_count, avg_score_pct, rank_in_subject, percentile
                                FROM subject_performance
                                WHERE student_id = :student_id
                                ORDER BY avg_score_pct DESC NULLS LAST, subject_id
                                """)
                        .parameterSchema(ParameterSchema.of(ParameterSpec.required("student_id", ParameterType.LONG)))
                        .defaultLimit(50)
                        .maxLimit(1000)
                        .build(),
                QueryDefinition.builder()
                        .name("student_progress_over_time")
                        .description("One student's submissions and grades bucketed by day, week or month")
                        .target(QueryTarget.liveTables("assignments_assignmentsubmission"))
                        .sql("""
                                SELECT DATE_TRUNC(:granularity, s.submitted_at) AS period_start,
                                       COUNT(*) AS submissions_count,
                                       COUNT(*) FILTER (WHERE s.status = 'graded') AS graded_count,
                                       ROUND(AVG(s.score * 100.0 / NULLIF(s.max_score, 0))
                                             FILTER (WHERE s.status = 'graded'), 2) AS avg_score_pct
                                FROM assignments_assignmentsubmission s
                                WHERE s.student_id = :student_id
                                  AND s.submitted_at >= NOW() - MAKE_INTERVAL(days => :days_back)
                                GROUP BY 1
                                ORDER BY 1
                                """)
                        .parameterSchema(ParameterSchema.of(
                                ParameterSpec.required("student_id", ParameterType.LONG),
                                GRANULARITY,
                                DAYS_BACK_30))
                        .defaultLimit(100)
                        .maxLimit(10000)
                        .build(),
                QueryDefinition.builder()
                        .name("student_engagement")
                        .description("Submission activity of every active student")
                        .target(QueryTarget.liveTables("accounts_user", "assignments_assignmentsubmission"))
                        .sql("""
                                SELECT u.id AS student_id,
                                       u.first_name,
                                       u.last_name,
                                       COUNT(s.id) AS submissions_count,
                                       COUNT(DISTINCT DATE(s.submitted_at)) AS active_days,
                                       ROUND(COUNT(DISTINCT DATE(s.submitted_at)) * 100.0 / :days_back, 2) AS active_days_pct,
                                       MAX(s.submitted_at) AS last_activity_at
                                FROM accounts_user u
                                LEFT JOIN assignments_assignmentsubmission s
                                       ON s.student_id = u.id
                                      AND s.submitted_at >= NOW() - MAKE_INTERVAL(days => :days_back)
                                WHERE u.role = 'student' AND u.is_active
                                GROUP BY u.id, u.first_name, u.last_name
                                ORDER BY submissions_count DESC, u.id
                                """)
                        .parameterSchema(ParameterSchema.of(DAYS_BACK_30))
                        .defaultLimit(50)
                        .maxLimit(10000)
                        .statementTimeout(Duration.ofSeconds(60))
                        .build(),
                QueryDefinition.builder()
                        .name("class_progress")
                        .description("Weekly progress per subject")
                        .target(QueryTarget.view(CLASS_PROGRESS_SUMMARY))
                        .sql("""
                                SELECT subject_id, period_start, active_students, submissions_count,
                                       graded_count, avg_score_pct
                                FROM class_progress_summary
                                WHERE (CAST(:subject_id AS BIGINT) IS NULL OR subject_id = :subject_id)
                                  AND period_start >= DATE_TRUNC('week', NOW() - MAKE_INTERVAL(days => :days_back))
                                ORDER BY period_start DESC, subject_id
                                """)
                        .parameterSchema(ParameterSchema.of(SUBJECT_FILTER, DAYS_BACK_90))
                        .defaultLimit(200)
                        .maxLimit(5000)
                        .build(),
                QueryDefinition.builder()
                        .name("class_performance_trends")
                        .description("Per subject activity and grades bucketed by day, week or month")
                        .target(QueryTarget.liveTables("assignments_assignmentsubmission", "assignments_assignment",
                                "materials_subject"))
                        .sql("""
                                SELECT a.subject_id,
                                       subj.name AS subject_name,
                                       DATE_TRUNC(:granularity, s.submitted_at) AS period_start,
                                       COUNT(DISTINCT s.student_id) AS active_students,
                                       COUNT(*) AS submissions_count,
                                       COUNT(*) FILTER (WHERE s.status = 'graded') AS graded_count,
                                       ROUND(AVG(s.score * 100.0 / NULLIF(s.max_score, 0))
                                             FILTER (WHERE s.status = 'graded'), 2) AS avg_score_pct
                                FROM assignments_assignmentsubmission s
                                JOIN assignments_assignment a ON a.id = s.assignment_id
                                JOIN materials_subject subj ON subj.id = a.subject_id
                                WHERE s.submitted_at >= NOW() - MAKE_INTERVAL(days => :days_back)
                                  AND (CAST(:subject_id AS BIGINT) IS NULL OR a.subject_id = :subject_id)
                                GROUP BY a.subject_id, subj.name, 3
                                ORDER BY 3 DESC, a.subject_id
                                """)
                        .parameterSchema(ParameterSchema.of(GRANULARITY, DAYS_BACK_90, SUBJECT_FILTER))
                        .defaultLimit(200)
                        .maxLimit(10000)
                        .statementTimeout(Duration.ofSeconds(60))
                        .build(),
                QueryDefinition.builder()
                        .name("attendance_grades_correlation")
                        .description("Active days against graded score per student, with the overall correlation")
                        .target(QueryTarget.liveTables("accounts_user", "assignments_assignmentsubmission"))
                        .sql("""
                                WITH per_student AS (
                                    SELECT u.id AS student_id,
                                           COUNT(DISTINCT DATE(s.submitted_at)) AS active_days,
                                           ROUND(COUNT(DISTINCT DATE(s.submitted_at)) * 100.0 / :days_back, 2)
                                               AS attendance_pct,
                                           COUNT(*) FILTER (WHERE s.status = 'graded') AS graded_count,
                                           ROUND(AVG(s.score * 100.0 / NULLIF(s.max_score, 0))
                                                 FILTER (WHERE s.status = 'graded'), 2) AS avg_score_pct
                                    FROM accounts_user u
                                    JOIN assignments_assignmentsubmission s
                                      ON s.student_id = u.id
                                     AND s.submitted_at >= NOW() - MAKE_INTERVAL(days => :days_back)
                                    WHERE u.role = 'student' AND u.is_active
                                    GROUP BY u.id
                                )
                                SELECT student_id, active_days, attendance_pct, graded_count, avg_score_pct,
                                       ROUND(CAST(CORR(CAST(attendance_pct AS DOUBLE PRECISION),
                                                       CAST(avg_score_pct AS DOUBLE PRECISION)) OVER () AS NUMERIC), 3)
                                           AS attendance_grade_corr
                                FROM per_student
                                ORDER BY attendance_pct DESC, student_id
                                """)
                        .parameterSchema(ParameterSchema.of(DAYS_BACK_90))
                        .defaultLimit(100)
                        .maxLimit(10000)
                        .statementTimeout(Duration.ofSeconds(60))
                        .build(),
                QueryDefinition.builder()
                        .name("teacher_workload")
                        .description("Review and grading workload of one teacher")
                        .target(QueryTarget.view(TEACHER_WORKLOAD))
                        .sql("""
                                SELECT teacher_id, total_assignments, total_submissions, pending_reviews,
                                       overdue_reviews, avg_grade_time_hours
                                FROM teacher_workload
                                WHERE teacher_id = :teacher_id
                                """)
                        .parameterSchema(ParameterSchema.of(ParameterSpec.required("teacher_id", ParameterType.LONG)))
                        .defaultLimit(1)
                        .maxLimit(1)
                        .replicaEligible(false)
                        .build(),
                QueryDefinition.builder()
                        .name("top_performers")
                        .description("Best ranked students per subject")
                        .target(QueryTarget.view(SUBJECT_PERFORMANCE))
                        .sql("""
                                SELECT subject_id, student_id, submissions_count, avg_score_pct, rank_in_subject, percentile
                                FROM subject_performance
                                WHERE submissions_count >= :min_submissions
                                  AND (CAST(:subject_id AS BIGINT) IS NULL OR subject_id = :subject_id)
                                ORDER BY avg_score_pct DESC NULLS LAST, subject_id, student_id
                                """)
                        .parameterSchema(ParameterSchema.of(MIN_SUBMISSIONS, SUBJECT_FILTER))
                        .defaultLimit(20)
                        .maxLimit(1000)
                        .build(),
                QueryDefinition.builder()
                        .name("bottom_performers")
                        .description("Lowest ranked students per subject")
                        .target(QueryTarget.view(SUBJECT_PERFORMANCE))
                        .sql("""
                                SELECT subject_id, student_id, submissions_count, avg_score_pct, rank_in_subject, percentile
                                FROM subject_performance
                                WHERE submissions_count >= :min_submissions
                                  AND (CAST(:subject_id AS BIGINT) IS NULL OR subject_id = :subject_id)
                                ORDER BY avg_score_pct ASC NULLS LAST, subject_id, student_id
                                """)
                        .parameterSchema(ParameterSchema.of(MIN_SUBMISSIONS, SUBJECT_FILTER))
                        .defaultLimit(20)
                        .maxLimit(1000)
                        .build());
    }

    private static ParameterSpec daysBack(int defaultDays) {
        return ParameterSpec.builder()
                .name("days_back").type(ParameterType.INTEGER).defaultValue(defaultDays).min(1L).max(365L)
                .build();
    }
}
