package io.taskdesk.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.taskdesk.error.NotFoundException;
import io.taskdesk.error.StorageException;
import io.taskdesk.error.ValidationException;
import io.taskdesk.model.TaskDraft;
import io.taskdesk.model.TaskPage;
import io.taskdesk.query.TaskQuery;
import io.taskdesk.runtime.TaskDeskRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP surface of the task list: the listing page, the form endpoints and a JSON listing API.
 *
 * <p>Every mutation ends in a redirect to {@code /}. A missing task on toggle, edit or delete
 * is tolerated the same way; a rejected form renders a 400 page and a storage failure a 500.
 */
public final class TaskWebServer {
    private static final Logger log = LoggerFactory.getLogger(TaskWebServer.class);

    private final TaskDeskRuntime runtime;
    private final String host;
    private final int port;
    private final int threads;
    private HttpServer server;
    private ExecutorService executor;

    public TaskWebServer(TaskDeskRuntime runtime, String host, int port, int threads) {
        this.runtime = runtime;
        this.host = host;
        this.port = port;
        this.threads = Math.max(1, threads);
    }

    /**
     * Binds and starts serving. Returns the bound port, which differs from the configured one
     * when the configured port is 0.
     */
    public synchronized int start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Server already started");
        }
        HttpServer created = HttpServer.create(new InetSocketAddress(host, port), 0);
        created.createContext("/", exchange -> handle(exchange, this::index));
        created.createContext("/add", exchange -> handle(exchange, this::add));
        created.createContext("/toggle/", exchange -> handle(exchange, this::toggle));
        created.createContext("/edit/", exchange -> handle(exchange, this::edit));
        created.createContext("/delete/", exchange -> handle(exchange, this::delete));
        created.createContext("/api/tasks", exchange -> handle(exchange, this::apiTasks));
        executor = Executors.newFixedThreadPool(threads);
        created.setExecutor(executor);
        created.start();
        server = created;
        int bound = created.getAddress().getPort();
        log.info("Serving tasks on http://{}:{}/", host, bound);
        return bound;
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop(0);
        executor.shutdownNow();
        server = null;
        executor = null;
        log.info("Web server stopped");
    }

    private void index(HttpExchange exchange) throws IOException {
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            notFound(exchange);
            return;
        }
        if (!HttpExchanges.allowMethods(exchange, "GET")) return;
        TaskQuery query = TaskQuery.fromParams(HttpExchanges.parseQuery(exchange.getRequestURI()));
        TaskPage result = runtime.listTasks(query);
        HttpExchanges.writeHtml(exchange, TaskListPage.render(ListingView.of(query, result), runtime.today()), 200);
    }

    private void add(HttpExchange exchange) throws IOException {
        if (!"/add".equals(exchange.getRequestURI().getPath())) {
            notFound(exchange);
            return;
        }
        if (!HttpExchanges.allowMethods(exchange, "POST")) return;
        runtime.addTask(draftFrom(HttpExchanges.parseParams(exchange)));
        HttpExchanges.redirect(exchange, "/");
    }

    private void toggle(HttpExchange exchange) throws IOException {
        OptionalLong id = pathId(exchange, "/toggle/");
        if (id.isEmpty()) {
            notFound(exchange);
            return;
        }
        if (!HttpExchanges.allowMethods(exchange, "GET")) return;
        runtime.toggleTask(id.getAsLong());
        HttpExchanges.redirect(exchange, "/");
    }

    private void edit(HttpExchange exchange) throws IOException {
        OptionalLong id = pathId(exchange, "/edit/");
        if (id.isEmpty()) {
            notFound(exchange);
            return;
        }
        if (!HttpExchanges.allowMethods(exchange, "POST")) return;
        runtime.editTask(id.getAsLong(), draftFrom(HttpExchanges.parseParams(exchange)));
        HttpExchanges.redirect(exchange, "/");
    }

    private void delete(HttpExchange exchange) throws IOException {
        OptionalLong id = pathId(exchange, "/delete/");
        if (id.isEmpty()) {
            notFound(exchange);
            return;
        }
        if (!HttpExchanges.allowMethods(exchange, "GET")) return;
        runtime.deleteTask(id.getAsLong());
        HttpExchanges.redirect(exchange, "/");
    }

    private void apiTasks(HttpExchange exchange) throws IOException {
        if (!"/api/tasks".equals(exchange.getRequestURI().getPath())) {
            notFound(exchange);
            return;
        }
        if (!HttpExchanges.allowMethods(exchange, "GET")) return;
        TaskQuery query = TaskQuery.fromParams(HttpExchanges.parseQuery(exchange.getRequestURI()));
        TaskPage result = runtime.listTasks(query);
        ListingView view = ListingView.of(query, result);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tasks", result.rows());
        body.put("page", result.page());
        body.put("pageSize", result.pageSize());
        body.put("totalCount", result.totalCount());
        body.put("totalPages", result.totalPages());
        body.put("filters", view.filterParams());
        HttpExchanges.writeJson(exchange, body, 200);
    }

    private void handle(HttpExchange exchange, Route route) throws IOException {
        try {
            route.handle(exchange);
        } catch (ValidationException e) {
            log.debug("Rejected {} {}: {}", exchange.getRequestMethod(), exchange.getRequestURI(), e.getMessage());
            HttpExchanges.writeHtml(exchange, TaskListPage.renderError(400, e.getMessage()), 400);
        } catch (NotFoundException e) {
            log.debug("Ignoring {} on missing task {}", exchange.getRequestURI().getPath(), e.taskId());
            HttpExchanges.redirect(exchange, "/");
        } catch (StorageException e) {
            log.error("Storage failure serving {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            HttpExchanges.writeHtml(exchange, TaskListPage.renderError(500, "The task database is unavailable."), 500);
        } catch (RuntimeException e) {
            log.error("Unexpected failure serving {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            HttpExchanges.writeHtml(exchange, TaskListPage.renderError(500, "Internal server error."), 500);
        } finally {
            exchange.close();
        }
    }

    private static void notFound(HttpExchange exchange) throws IOException {
        HttpExchanges.writeHtml(exchange, TaskListPage.renderError(404, "Page not found."), 404);
    }

    static OptionalLong pathId(HttpExchange exchange, String prefix) {
        return parseId(exchange.getRequestURI().getPath(), prefix);
    }

    static OptionalLong parseId(String path, String prefix) {
        if (path == null || !path.startsWith(prefix)) {
            return OptionalLong.empty();
        }
        String raw = path.substring(prefix.length());
        if (raw.isEmpty() || raw.length() > 18) {
            return OptionalLong.empty();
        }
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch < '0' || ch > '9') {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.of(Long.parseLong(raw));
    }

    private static TaskDraft draftFrom(Map<String, String> form) {
        return TaskDraft.of(
                form.get("title"),
                form.getOrDefault("description", ""),
                form.getOrDefault("priority", "medium"),
                form.getOrDefault("category", "personal"),
                form.get("due_date")
        );
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange) throws IOException;
    }
}
