package dtm.strata.storage.containers;

import dtm.strata.core.DependencyContainer;
import dtm.strata.core.ScopedDependencyContainer;
import dtm.strata.exceptions.CircularDependencyException;
import dtm.strata.exceptions.ContainerDestroyedException;
import dtm.strata.exceptions.DependencyFinalizationException;
import dtm.strata.exceptions.UnknownDependencyException;
import dtm.strata.prototypes.Tag;
import org.junit.jupiter.api.Test;

import java.lang.ref.WeakReference;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScopedDependencyContainerStorageTest {

    @Test
    void childRegistrationShadowsParent() {
        Tag<String> greeting = Tag.of("greeting");
        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime")
                .register(greeting, c -> "runtime");
        ScopedDependencyContainer request = runtime.child("request")
                .register(greeting, c -> "request");

        assertEquals("request", request.get(greeting));
        assertEquals("runtime", runtime.get(greeting));
    }

    @Test
    void childrenShareTheParentInstance() {
        Tag<Object> database = Tag.of("database");
        AtomicInteger calls = new AtomicInteger();
        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime")
                .register(database, c -> {
                    calls.incrementAndGet();
                    return new Object();
                });

        ScopedDependencyContainer first = runtime.child("request-1");
        ScopedDependencyContainer second = runtime.child("request-2");

        assertTrue(first.has(database));
        assertFalse(first.exists(database));

        Object fromFirst = first.get(database);
        Object fromSecond = second.get(database);

        assertSame(fromFirst, fromSecond);
        assertSame(fromFirst, runtime.get(database));
        assertEquals(1, calls.get());
        assertTrue(first.exists(database));
        assertTrue(runtime.exists(database));
    }

    @Test
    void instanceIsCreatedWithTheDependenciesOfItsOwnScope() {
        Tag<String> config = Tag.of("config");
        Tag<String> service = Tag.of("service");
        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime")
                .register(config, c -> "runtime-config")
                .register(service, c -> "service(" + c.get(config) + ")");
        ScopedDependencyContainer request = runtime.child("request")
                .register(config, c -> "request-config");

        assertEquals("service(runtime-config)", request.get(service));
        assertEquals("request-config", request.get(config));
    }

    @Test
    void unknownTagFailsInEveryScope() {
        Tag<String> missing = Tag.of("missing");
        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime");
        ScopedDependencyContainer request = runtime.child("request");

        assertFalse(request.has(missing));
        assertThrows(UnknownDependencyException.class, () -> request.get(missing));
    }

    @Test
    void cycleThroughTheParentKeepsTheChain() {
        Tag<String> first = Tag.of("first");
        Tag<String> second = Tag.of("second");
        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime")
                .register(first, c -> c.get(second))
                .register(second, c -> c.get(first));
        ScopedDependencyContainer request = runtime.child("request");

        CircularDependencyException exception = assertThrows(CircularDependencyException.class, () -> request.get(first));
        assertEquals(List.of(first, second), exception.getChain());
    }

    @Test
    void childScopesAreDestroyedBeforeTheParent() {
        Tag<String> parentValue = Tag.of("parentValue");
        Tag<String> childValue = Tag.of("childValue");
        Tag<String> grandChildValue = Tag.of("grandChildValue");
        List<String> order = new CopyOnWriteArrayList<>();

        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime")
                .register(parentValue, c -> "parent", order::add);
        ScopedDependencyContainer request = runtime.child("request")
                .register(childValue, c -> "child", order::add);
        ScopedDependencyContainer nested = request.child("nested")
                .register(grandChildValue, c -> "grandchild", order::add);

        nested.get(grandChildValue);
        request.get(childValue);
        runtime.get(parentValue);

        runtime.destroy();

        assertEquals(List.of("grandchild", "child", "parent"), order);
        assertTrue(runtime.isDestroyed());
        assertTrue(request.isDestroyed());
        assertTrue(nested.isDestroyed());
    }

    @Test
    void destroyedChildIsDetachedFromItsParent() {
        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime");
        ScopedDependencyContainer request = runtime.child("request");
        ScopedDependencyContainer other = runtime.child("other");

        assertEquals(2, runtime.getLiveChildren().size());

        request.destroy();

        assertEquals(List.of(other), runtime.getLiveChildren());
        assertTrue(request.getParent().isEmpty());
        assertFalse(runtime.isDestroyed());
    }

    @Test
    void parentDoesNotKeepChildrenAlive() throws InterruptedException {
        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime");
        WeakReference<ScopedDependencyContainer> child = new WeakReference<>(runtime.child("request"));

        for (int i = 0; i < 50 && child.get() != null; i++) {
            System.gc();
            Thread.sleep(20);
        }

        assertNull(child.get());
        assertTrue(runtime.getLiveChildren().isEmpty());
        assertDoesNotThrow(runtime::destroy);
        assertTrue(runtime.isDestroyed());
    }

    @Test
    void destroyedChildDoesNotDelegateToItsFormerParent() {
        Tag<String> value = Tag.of("value");
        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime")
                .register(value, c -> "v");
        ScopedDependencyContainer request = runtime.child("request");

        request.destroy();

        assertThrows(ContainerDestroyedException.class, () -> request.get(value));
        assertEquals("v", runtime.get(value));
    }

    @Test
    void destroyedScopeCannotCreateChildren() {
        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime");
        runtime.destroy();

        assertThrows(ContainerDestroyedException.class, () -> runtime.child("request"));
        assertThrows(ContainerDestroyedException.class, () -> runtime.register(Tag.<String>of("late"), c -> "late"));
    }

    @Test
    void finalizerFailuresFromChildrenAndParentAreFlattened() {
        Tag<String> parentValue = Tag.of("parentValue");
        Tag<String> childValue = Tag.of("childValue");
        List<String> finalized = new CopyOnWriteArrayList<>();

        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime")
                .register(parentValue, c -> "parent", instance -> {
                    finalized.add(instance);
                    throw new IllegalStateException("parent finalizer");
                });
        ScopedDependencyContainer request = runtime.child("request")
                .register(childValue, c -> "child", instance -> {
                    finalized.add(instance);
                    throw new IllegalArgumentException("child finalizer");
                });

        request.get(childValue);
        runtime.get(parentValue);

        DependencyFinalizationException exception = assertThrows(DependencyFinalizationException.class, runtime::destroy);

        assertEquals(2, exception.getErrorsSize());
        assertInstanceOf(IllegalArgumentException.class, exception.getErrors().get(0));
        assertInstanceOf(IllegalStateException.class, exception.getErrors().get(1));
        assertEquals(List.of("child", "parent"), finalized);
        assertTrue(runtime.isDestroyed());
        assertTrue(request.isDestroyed());
    }

    @Test
    void childInheritsFailureCachingSetting() {
        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime");
        runtime.disableFailureCaching();

        assertFalse(runtime.child("request").isFailureCachingEnabled());
    }

    @Test
    void mergeCreatesARootScopeWithTheSameLabel() {
        Tag<String> mine = Tag.of("mine");
        Tag<String> theirs = Tag.of("theirs");
        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.create("runtime");
        ScopedDependencyContainer request = runtime.child("request")
                .register(mine, c -> "mine");
        DependencyContainer other = DependencyContainerStorage.create()
                .register(theirs, c -> "theirs");

        ScopedDependencyContainer merged = request.merge(other);

        assertEquals("request", merged.getScope());
        assertTrue(merged.getParent().isEmpty());
        assertEquals("mine", merged.get(mine));
        assertEquals("theirs", merged.get(theirs));
    }

    @Test
    void scopedLiftsAPlainContainer() {
        Tag<String> value = Tag.of("value");
        DependencyContainer plain = DependencyContainerStorage.create()
                .register(value, c -> "v");

        ScopedDependencyContainerStorage runtime = ScopedDependencyContainerStorage.scoped(plain, "runtime");

        assertEquals("runtime", runtime.getScope());
        assertEquals("v", runtime.child("request").get(value));
    }
}
