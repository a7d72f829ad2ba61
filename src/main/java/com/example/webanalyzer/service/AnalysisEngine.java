package com.example.webanalyzer.service;

import com.example.webanalyzer.metrics.AnalysisMetrics;
import com.example.webanalyzer.model.WebpageAnalysis;
import com.example.webanalyzer.service.extraction.ExtractionPass;
import com.example.webanalyzer.service.extraction.PageContext;
import com.example.webanalyzer.worker.AnalysisTaskGroup;
import com.example.webanalyzer.worker.TaskHandle;
import com.example.webanalyzer.worker.TaskOutcome;
import com.example.webanalyzer.worker.WorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Параллельный запуск проходов извлечения над одним документом и сборка результата.
 *
 * На каждый проход создаётся одна задача в {@link AnalysisTaskGroup}. Ошибка прохода
 * оставляет соответствующее поле пустым и попадает в {@code extractionErrors}.
 * Время анализа и момент завершения выставляет вызывающий код.
 */
@Slf4j
@Service
public class AnalysisEngine {

    private final List<ExtractionPass<?>> passes;
    private final WorkerPool workerPool;
    private final AnalysisMetrics analysisMetrics;

    public AnalysisEngine(List<ExtractionPass<?>> passes,
                          WorkerPool workerPool,
                          AnalysisMetrics analysisMetrics) {
        this.passes = List.copyOf(passes);
        this.workerPool = workerPool;
        this.analysisMetrics = analysisMetrics;
    }

    public WebpageAnalysis extract(Document document, String pageUrl) throws InterruptedException {
        PageContext context = new PageContext(document, pageUrl);
        AnalysisTaskGroup group = new AnalysisTaskGroup(workerPool);

        List<PendingPass<?>> pending = new ArrayList<>(passes.size());
        for (ExtractionPass<?> pass : passes) {
            pending.add(PendingPass.schedule(group, pass, context));
        }

        log.debug("Running {} extraction passes for {}", pending.size(), pageUrl);
        group.executeAll();

        WebpageAnalysis.WebpageAnalysisBuilder builder = WebpageAnalysis.builder().url(pageUrl);
        for (PendingPass<?> pass : pending) {
            String error = pass.collect(group, builder);
            if (error != null) {
                analysisMetrics.recordPassFailed(pass.getName());
                builder.extractionError(pass.getName(), error);
            }
        }
        return builder.build();
    }

    public List<String> getPassNames() {
        List<String> names = new ArrayList<>(passes.size());
        passes.forEach(pass -> names.add(pass.getName()));
        return names;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Проход вместе с типизированной ссылкой на его результат.
     */
    private static final class PendingPass<T> {
        private final ExtractionPass<T> pass;
        private final TaskHandle<T> handle;

        private PendingPass(ExtractionPass<T> pass, TaskHandle<T> handle) {
            this.pass = pass;
            this.handle = handle;
        }

        static <T> PendingPass<T> schedule(AnalysisTaskGroup group, ExtractionPass<T> pass, PageContext context) {
            return new PendingPass<>(pass, group.addTask(pass.getName(), () -> pass.extract(context)));
        }

        String getName() {
            return pass.getName();
        }

        /**
         * Переносит результат в builder.
         *
         * @return сообщение об ошибке или {@code null}, если проход успешен
         */
        String collect(AnalysisTaskGroup group, WebpageAnalysis.WebpageAnalysisBuilder builder) {
            TaskOutcome<T> outcome = group.getResult(handle);
            if (!outcome.isSuccess()) {
                return describe(outcome.getError());
            }
            try {
                pass.apply(outcome.getValue(), builder);
                return null;
            } catch (RuntimeException e) {
                log.warn("Failed to apply result of pass '{}': {}", pass.getName(), e.toString());
                return describe(e);
            }
        }
    }
}
