package org.tramway.http.routing;

import org.junit.jupiter.api.Test;
import org.tramway.http.common.HttpMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouterConcurrencyTest {

    private static final int THREADS = 8;
    private static final int ITERATIONS = 2_000;

    @Test
    void concurrentMatchesAgreeWithSequentialOnes() throws Exception {
        Router router = new Router();
        for (int i = 0; i < 50; i++) {
            router.get("/static/page" + i, (request, response) -> response.send("page"));
        }
        router.get("/users/:id", (request, response) -> response.send("user"));
        router.get("/users/:id/posts/:postId", (request, response) -> response.send("post"));
        router.get("/files/*rest", (request, response) -> response.send("file"));
        router.freeze();

        List<String> paths = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            paths.add("/static/page" + i);
            paths.add("/users/" + i);
            paths.add("/users/" + i + "/posts/" + (i * 7));
            paths.add("/files/dir" + i + "/name.txt");
            paths.add("/missing/" + i);
        }

        List<String> expected = new ArrayList<>();
        for (String path : paths) {
            expected.add(describe(router.match(HttpMethod.GET, path)));
        }

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                int offset = t;
                Callable<Integer> task = () -> {
                    start.await();
                    int mismatches = 0;
                    for (int i = 0; i < ITERATIONS; i++) {
                        int index = (i + offset) % paths.size();
                        if (!expected.get(index).equals(describe(router.match(HttpMethod.GET, paths.get(index))))) {
                            mismatches++;
                        }
                    }
                    return mismatches;
                };
                results.add(executor.submit(task));
            }
            start.countDown();

            for (Future<Integer> result : results) {
                assertEquals(0, result.get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }
    }

    private static String describe(Optional<RouteMatch> match) {
        return match.map(m -> m.pattern() + " " + m.pathParams()).orElse("404");
    }

}
