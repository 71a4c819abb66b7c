package dtm.strata.startup;

import dtm.strata.core.DependencyContainer;
import dtm.strata.core.Layer;
import dtm.strata.core.ScopedDependencyContainer;
import dtm.strata.exceptions.UnsatisfiedLayerException;
import dtm.strata.prototypes.Tag;
import dtm.strata.storage.containers.ScopedDependencyContainerStorage;
import dtm.strata.utils.FutureUtils;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ciclo de vida gerenciado de uma aplicação: um escopo {@value #RUNTIME_SCOPE} criado a partir de um
 * layer completo, e um escopo filho por unidade de trabalho (por padrão {@value #REQUEST_SCOPE}),
 * sempre destruído ao final do trabalho.
 * <pre>{@code
 * ManagedContainerStartup startup = new ManagedContainerStartup();
 * startup.start(applicationLayer);
 * startup.enableShutdownHook();
 *
 * Response response = startup.runInScope(request -> {
 *     request.register(REQUEST_ID, c -> UUID.randomUUID().toString());
 *     return request.get(USER_SERVICE).handle(event);
 * });
 * }</pre>
 */
public class ManagedContainerStartup {
    private static final Logger logger = LoggerFactory.getLogger(ManagedContainerStartup.class);

    public static final String RUNTIME_SCOPE = "runtime";
    public static final String REQUEST_SCOPE = "request";

    private final AtomicReference<ScopedDependencyContainer> runtimeRef = new AtomicReference<>();
    private final AtomicReference<Thread> shutdownHookRef = new AtomicReference<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final boolean logEnabled;

    public ManagedContainerStartup() {
        this(true);
    }

    public ManagedContainerStartup(boolean logEnabled) {
        this.logEnabled = logEnabled;
    }

    /**
     * Cria o escopo {@value #RUNTIME_SCOPE} e aplica o layer da aplicação.
     *
     * @param layer layer sem requisitos pendentes
     * @return o escopo de runtime
     * @throws UnsatisfiedLayerException se o layer ainda exigir tags não fornecidos
     * @throws IllegalStateException     se já foi iniciado
     */
    public ScopedDependencyContainer start(@NonNull Layer layer){
        if(!layer.isComplete()){
            throw new UnsatisfiedLayerException(
                    "O layer de inicialização possui requisitos não fornecidos",
                    layer.getName(),
                    layer.getRequires()
            );
        }
        if(!started.compareAndSet(false, true)){
            throw new IllegalStateException("ManagedContainerStartup já foi iniciado");
        }

        final long startedAt = System.nanoTime();
        logInfo("Iniciando contêiner com o layer {}", layer.getName());

        try {
            List<Set<Tag<?>>> creationLayers = layer.verify();
            logDebug("Layer {} verificado: {} camadas de criação", layer.getName(), creationLayers.size());
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        ScopedDependencyContainer runtime = ScopedDependencyContainerStorage.create(RUNTIME_SCOPE);

        try {
            DependencyContainer applied = layer.apply(runtime);
            if(applied != runtime){
                runtime.destroy();
                runtime = (applied instanceof ScopedDependencyContainer scopedContainer)
                        ? scopedContainer
                        : ScopedDependencyContainerStorage.scoped(applied, RUNTIME_SCOPE);
            }
        } catch (RuntimeException e) {
            logError("Falha ao aplicar o layer {}: {}", layer.getName(), e.getMessage(), e);
            destroyAfterFailure(runtime, e);
            started.set(false);
            throw e;
        }

        runtimeRef.set(runtime);
        logInfo("Contêiner iniciado com {} registros em {} ms",
                runtime.getRegisteredTags().size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
        return runtime;
    }

    public ScopedDependencyContainer getRuntime(){
        ScopedDependencyContainer runtime = runtimeRef.get();
        if(runtime == null){
            throw new IllegalStateException("ManagedContainerStartup não foi iniciado ou já foi finalizado");
        }
        return runtime;
    }

    public boolean isRunning(){
        return runtimeRef.get() != null;
    }

    public <R> R runInScope(ScopeWork<R> work) throws Exception {
        return runInScope(REQUEST_SCOPE, work);
    }

    /**
     * Executa o trabalho em um escopo filho do runtime. O escopo é destruído exatamente uma vez,
     * com ou sem falha do trabalho. Se o trabalho e o destroy falharem, a falha do destroy é
     * anexada como suprimida à falha do trabalho.
     */
    public <R> R runInScope(@NonNull String scope, @NonNull ScopeWork<R> work) throws Exception {
        final ScopedDependencyContainer container = getRuntime().child(scope);
        Throwable failure = null;
        try {
            return work.run(container);
        } catch (Exception | Error e) {
            failure = e;
            throw e;
        } finally {
            closeScope(container, failure);
        }
    }

    public <R> CompletableFuture<R> runInScopeAsync(AsyncScopeWork<R> work){
        return runInScopeAsync(REQUEST_SCOPE, work);
    }

    public <R> CompletableFuture<R> runInScopeAsync(@NonNull String scope, @NonNull AsyncScopeWork<R> work){
        final ScopedDependencyContainer container;
        try {
            container = getRuntime().child(scope);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        return FutureUtils.invokeSafely(() -> work.run(container))
                .handle((result, error) -> container.destroyAsync()
                        .handle((ignored, destroyError) -> {
                            if(error != null){
                                Throwable cause = FutureUtils.unwrap(error);
                                if(destroyError != null){
                                    cause.addSuppressed(FutureUtils.unwrap(destroyError));
                                }
                                throw new CompletionException(cause);
                            }
                            if(destroyError != null){
                                logError("Falha ao destruir o escopo '{}'", scope, FutureUtils.unwrap(destroyError));
                                throw new CompletionException(FutureUtils.unwrap(destroyError));
                            }
                            return result;
                        }))
                .thenCompose(completion -> completion);
    }

    /**
     * Destrói o escopo de runtime (e todos os escopos de trabalho ainda vivos). Chamadas repetidas não fazem nada.
     */
    public void shutdown(){
        if(!shutdown.compareAndSet(false, true)) return;
        removeShutdownHook();

        ScopedDependencyContainer runtime = runtimeRef.getAndSet(null);
        if(runtime == null) return;

        logInfo("Finalizando contêiner de runtime");
        runtime.destroy();
        logInfo("Contêiner de runtime finalizado");
    }

    /**
     * Registra um shutdown hook da JVM que executa {@link #shutdown()}.
     */
    public void enableShutdownHook(){
        Thread hook = new Thread(this::shutdownFromHook, "strata-shutdown-hook");
        if(shutdownHookRef.compareAndSet(null, hook)){
            Runtime.getRuntime().addShutdownHook(hook);
            logDebug("Shutdown hook registrado");
        }
    }

    private void shutdownFromHook(){
        shutdownHookRef.set(null);
        try {
            shutdown();
        } catch (RuntimeException e) {
            logError("Erro ao finalizar o contêiner no shutdown hook: {}", e.getMessage(), e);
        }
    }

    private void removeShutdownHook(){
        Thread hook = shutdownHookRef.getAndSet(null);
        if(hook == null) return;
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logDebug("JVM já está em shutdown, hook mantido: {}", e.getMessage());
        }
    }

    private void closeScope(ScopedDependencyContainer container, Throwable failure){
        try {
            container.destroy();
        } catch (RuntimeException destroyError) {
            if(failure == null) throw destroyError;
            logError("Falha ao destruir o escopo '{}' após erro no trabalho", container.getScope(), destroyError);
            failure.addSuppressed(destroyError);
        }
    }

    private void destroyAfterFailure(DependencyContainer container, RuntimeException failure){
        try {
            container.destroy();
        } catch (RuntimeException destroyError) {
            failure.addSuppressed(destroyError);
        }
    }

    private void logInfo(String msg, Object... args) {
        if (logEnabled) logger.info(msg, args);
    }

    private void logDebug(String msg, Object... args) {
        if (logEnabled) logger.debug(msg, args);
    }

    private void logError(String msg, Object... args) {
        logger.error(msg, args);
    }

    /**
     * Trabalho síncrono executado dentro de um escopo.
     */
    @FunctionalInterface
    public interface ScopeWork<R> {
        R run(ScopedDependencyContainer container) throws Exception;
    }

    @FunctionalInterface
    public interface AsyncScopeWork<R> {
        CompletableFuture<R> run(ScopedDependencyContainer container) throws Exception;
    }
}
