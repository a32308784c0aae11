package tech.tasktracker.backend.endpoint;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.tasktracker.backend.task.Task;
import tech.tasktracker.backend.task.TaskService;
import tech.tasktracker.backend.task.TaskStatus;

import java.util.List;
import java.util.Map;

@Path("/tasks")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Tasks", description = "Task CRUD")
public class TaskResource {

    private static final String NOT_FOUND = "Task not found";

    @Inject
    TaskService taskService;

    @GET
    @Operation(summary = "List tasks")
    public List<Task> list() {
        return taskService.list();
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get a task")
    public Response get(@PathParam("id") long id) {
        return taskService.get(id)
            .map(task -> Response.ok(task).build())
            .orElseGet(TaskResource::notFound);
    }

    @POST
    @Operation(summary = "Create a task")
    public Response create(@QueryParam("title") String title, @QueryParam("description") String description) {
        if (title == null || title.isBlank()) {
            return badRequest("Query parameter [title] is required");
        }
        return Response.ok(taskService.create(title, description)).build();
    }

    @PUT
    @Path("/{id}")
    @Operation(summary = "Update a task", description = "Only the given query parameters are changed")
    public Response update(
            @PathParam("id") long id,
            @QueryParam("title") String title,
            @QueryParam("description") String description,
            @QueryParam("status") String status) {
        TaskStatus newStatus;
        try {
            newStatus = status != null ? TaskStatus.fromValue(status) : null;
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
        return taskService.update(id, title, description, newStatus)
            .map(task -> Response.ok(task).build())
            .orElseGet(TaskResource::notFound);
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete a task")
    public Response delete(@PathParam("id") long id) {
        return taskService.delete(id)
            .map(task -> Response.ok(Map.of("ok", true)).build())
            .orElseGet(TaskResource::notFound);
    }

    private static Response notFound() {
        return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(NOT_FOUND)).build();
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(message)).build();
    }
}
