package com.example.shortvideo_backend.service;

import com.example.shortvideo_backend.config.PipelineProperties;
import com.example.shortvideo_backend.dto.CaptionToken;
import com.example.shortvideo_backend.dto.ClipRef;
import com.example.shortvideo_backend.dto.GenerationMetadata;
import com.example.shortvideo_backend.dto.HybridOptions;
import com.example.shortvideo_backend.dto.RenderOptions;
import com.example.shortvideo_backend.dto.ResolvedScene;
import com.example.shortvideo_backend.dto.SceneRequest;
import com.example.shortvideo_backend.engine.Interfaces.AiVideoEngine;
import com.example.shortvideo_backend.engine.Interfaces.CaptionEngine;
import com.example.shortvideo_backend.engine.Interfaces.SpeechEngine;
import com.example.shortvideo_backend.engine.Interfaces.StockFootageEngine;
import com.example.shortvideo_backend.exception.CollaboratorException;
import com.example.shortvideo_backend.exception.GenerationException;
import com.example.shortvideo_backend.util.Provenance;
import com.example.shortvideo_backend.util.VideoStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Turns one {@link SceneRequest} into a {@link ResolvedScene}: narration, captions, then a visual
 * from either the AI generator or stock footage. Only downloads and AI generation are retried.
 */
@Service
public class SceneProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneProcessor.class);
    private static final int MAX_DERIVED_TERMS = 3;

    private final SpeechEngine speechEngine;
    private final CaptionEngine captionEngine;
    private final StockFootageEngine stockFootageEngine;
    private final AiVideoEngine aiVideoEngine;
    private final RetryExecutor retryExecutor;
    private final Random random;
    private final Duration downloadTimeout;

    public SceneProcessor(SpeechEngine speechEngine,
                          CaptionEngine captionEngine,
                          StockFootageEngine stockFootageEngine,
                          AiVideoEngine aiVideoEngine,
                          RetryExecutor retryExecutor,
                          Random random,
                          PipelineProperties properties) {
        this.speechEngine = speechEngine;
        this.captionEngine = captionEngine;
        this.stockFootageEngine = stockFootageEngine;
        this.aiVideoEngine = aiVideoEngine;
        this.retryExecutor = retryExecutor;
        this.random = random;
        this.downloadTimeout = properties.getDownloadTimeout();
    }

    public ResolvedScene resolve(SceneRequest scene, RenderOptions options, SceneContext ctx, SceneStageListener listener) {
        int idx = ctx.sceneIndex();

        listener.onStage(VideoStatus.GENERATING_AUDIO);
        SpeechEngine.Speech speech = call("speech synthesis", () -> speechEngine.synthesize(scene.text(), options.voice()));
        String audioExt = speech.format() == null || speech.format().isBlank() ? "wav" : speech.format();
        Path audioPath = ctx.workspace().write(idx, audioExt, speech.audio());
        double audioDuration = Math.max(0d, speech.durationSeconds());
        double visualDuration = audioDuration;
        if (ctx.isLast() && options.paddingBackMs() != null && options.paddingBackMs() > 0) {
            visualDuration += options.paddingBackMs() / 1000.0;
        }
        LOGGER.debug("SCENE AUDIO jobId={} scene={} audioSec={} visualSec={}", ctx.jobId(), idx, audioDuration, visualDuration);

        listener.onStage(VideoStatus.CREATING_CAPTIONS);
        List<CaptionToken> captions = call("caption transcription",
                () -> captionEngine.transcribe(speech.audio(), audioPath.getFileName().toString()));

        HybridOptions hybrid = options.hybrid() != null ? options.hybrid() : HybridOptions.defaults();
        if (shouldUseAi(scene, hybrid)) {
            listener.onStage(VideoStatus.GENERATING_AI_VIDEO);
            try {
                return aiScene(scene, options, hybrid, ctx, audioPath, audioDuration, visualDuration, captions);
            } catch (CollaboratorException e) {
                if (!hybrid.shouldFallBack()) {
                    throw new GenerationException("AI generation failed for scene %d: %s".formatted(idx, e.getMessage()), e);
                }
                LOGGER.warn("FALLBACK jobId={} scene={} from=ai to=stock cause={}", ctx.jobId(), idx, e.getMessage());
            }
        }

        listener.onStage(VideoStatus.DOWNLOADING_VIDEO);
        return stockScene(scene, options, ctx, audioPath, audioDuration, visualDuration, captions);
    }

    /**
     * A scene takes the AI path only when hybrid mode is on, and then either because the scene asks
     * for it or because the ratio draw says so. An explicit {@code false} opts the scene out.
     */
    boolean shouldUseAi(SceneRequest scene, HybridOptions hybrid) {
        if (!hybrid.isEnabled()) {
            return false;
        }
        Boolean requested = scene.useAiGeneration();
        if (requested != null) {
            return requested;
        }
        double ratio = hybrid.aiGenerationRatio() != null ? hybrid.aiGenerationRatio() : HybridOptions.DEFAULT_RATIO;
        return random.nextDouble() < ratio;
    }

    private ResolvedScene aiScene(SceneRequest scene, RenderOptions options, HybridOptions hybrid, SceneContext ctx,
                                  Path audioPath, double audioDuration, double visualDuration, List<CaptionToken> captions) {
        String prompt = aiPrompt(scene, hybrid);
        AiVideoEngine.Style style = new AiVideoEngine.Style(hybrid.style(), hybrid.quality(), options.orientation());
        AiVideoEngine.GeneratedClip clip = retryExecutor.execute("ai generation",
                () -> aiVideoEngine.generate(prompt, visualDuration, style));
        if (clip == null || clip.video() == null || clip.video().length == 0) {
            throw new CollaboratorException("ai generation", "AI generator returned no video", null);
        }
        Path clipPath = ctx.workspace().write(ctx.sceneIndex(), "mp4", clip.video());
        LOGGER.info("SCENE AI jobId={} scene={} latencyMs={} seed={}", ctx.jobId(), ctx.sceneIndex(), clip.latencyMs(), clip.seed());
        return new ResolvedScene(ctx.sceneIndex(), audioPath, audioDuration, visualDuration, captions, clipPath, null,
                Provenance.AI_GENERATED, new GenerationMetadata(prompt, clip.seed(), clip.latencyMs(), hybrid.quality()));
    }

    private ResolvedScene stockScene(SceneRequest scene, RenderOptions options, SceneContext ctx,
                                     Path audioPath, double audioDuration, double visualDuration, List<CaptionToken> captions) {
        List<String> terms = searchTerms(scene);
        ClipRef clip;
        byte[] video;
        try {
            clip = call("stock search", () -> stockFootageEngine.findClip(terms, visualDuration,
                    ctx.excludedClipIds(), options.orientation()));
            if (clip == null) {
                throw new GenerationException("No stock clip found for scene %d terms=%s".formatted(ctx.sceneIndex(), terms));
            }
            if (ctx.excludedClipIds().contains(clip.id())) {
                throw new GenerationException("Stock search returned already used clip %s for scene %d".formatted(clip.id(), ctx.sceneIndex()));
            }
            String url = clip.url();
            video = retryExecutor.execute("stock download", () -> stockFootageEngine.download(url, downloadTimeout));
        } catch (CollaboratorException e) {
            throw new GenerationException("No visual for scene %d: %s".formatted(ctx.sceneIndex(), e.getMessage()), e);
        }
        Path clipPath = ctx.workspace().write(ctx.sceneIndex(), "mp4", video);
        LOGGER.info("SCENE STOCK jobId={} scene={} clipId={} bytes={}", ctx.jobId(), ctx.sceneIndex(), clip.id(), video.length);
        return new ResolvedScene(ctx.sceneIndex(), audioPath, audioDuration, visualDuration, captions, clipPath, clip.id(),
                Provenance.STOCK, null);
    }

    static String aiPrompt(SceneRequest scene, HybridOptions hybrid) {
        if (notBlank(scene.videoPrompt())) return scene.videoPrompt().trim();
        if (notBlank(scene.imagePrompt())) return scene.imagePrompt().trim();
        String subject = scene.hasSearchTerm()
                ? String.join(", ", nonBlank(scene.searchTerms()))
                : abbreviate(scene.text(), 120);
        String style = hybrid.style() != null ? hybrid.style().promptFragment() : "photographic";
        return "%s, %s style, high quality, smooth camera motion".formatted(subject, style);
    }

    static List<String> searchTerms(SceneRequest scene) {
        if (scene.hasSearchTerm()) {
            return nonBlank(scene.searchTerms());
        }
        String source = notBlank(scene.videoPrompt()) ? scene.videoPrompt() : scene.imagePrompt();
        if (source == null) {
            return List.of();
        }
        return Arrays.stream(source.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(w -> w.length() > 3)
                .distinct()
                .limit(MAX_DERIVED_TERMS)
                .toList();
    }

    private <T> T call(String operation, Callable<T> callable) {
        try {
            return callable.call();
        } catch (RuntimeException e) {
            if (e instanceof GenerationException || e instanceof CollaboratorException) {
                throw e;
            }
            throw new CollaboratorException(operation, operation + " failed: " + RetryExecutor.describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(operation, operation + " interrupted", e);
        } catch (Exception e) {
            throw new CollaboratorException(operation, operation + " failed: " + RetryExecutor.describe(e), e);
        }
    }

    private static List<String> nonBlank(List<String> terms) {
        return terms.stream().filter(SceneProcessor::notBlank).map(String::trim).toList();
    }

    private static String abbreviate(String s, int max) {
        if (s == null) return "";
        String t = s.strip();
        return t.length() <= max ? t : t.substring(0, max);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
