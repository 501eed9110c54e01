package com.libragraph.revisions.api;

import com.libragraph.revisions.api.model.CreateDocumentRequest;
import com.libragraph.revisions.api.model.CreateRevisionRequest;
import com.libragraph.revisions.api.model.DocumentDetailResponse;
import com.libragraph.revisions.api.model.DocumentPageResponse;
import com.libragraph.revisions.api.model.DocumentResponse;
import com.libragraph.revisions.api.model.DocumentRevisionsResponse;
import com.libragraph.revisions.api.model.NodeDocumentLinkResponse;
import com.libragraph.revisions.api.model.RevisionContentResponse;
import com.libragraph.revisions.api.model.RevisionResponse;
import com.libragraph.revisions.core.dao.RevisionRecord;
import com.libragraph.revisions.core.diff.DiffResult;
import com.libragraph.revisions.core.error.ValidationException;
import com.libragraph.revisions.core.link.NodeDocumentLinkRegistry;
import com.libragraph.revisions.core.revision.DocumentDetail;
import com.libragraph.revisions.core.revision.RevisionService;
import com.libragraph.revisions.types.VersionBump;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.net.URI;
import java.util.List;

@Path("/documents")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DocumentResource {

    /** Identity of the caller, set by the upstream gateway. */
    public static final String USER_HEADER = "X-User-Id";

    @Inject
    RevisionService revisionService;

    @Inject
    NodeDocumentLinkRegistry linkRegistry;

    @GET
    public DocumentPageResponse list(@QueryParam("page") @DefaultValue("1") int page,
                                     @QueryParam("per_page") @DefaultValue("20") int perPage,
                                     @QueryParam("title_contains") String titleContains) {
        return DocumentPageResponse.from(revisionService.listDocuments(page, perPage, titleContains));
    }

    @POST
    public Response create(CreateDocumentRequest request, @HeaderParam(USER_HEADER) String userId) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        DocumentDetail created = revisionService.createDocument(
                request.title(), request.description(), request.content(), userId);
        return Response.created(URI.create("/documents/" + created.document().id()))
                .entity(DocumentDetailResponse.from(created))
                .build();
    }

    @GET
    @Path("/{id}")
    public DocumentDetailResponse get(@PathParam("id") String id) {
        return DocumentDetailResponse.from(revisionService.getDocument(id));
    }

    /** Appends a revision; the server picks the version. */
    @PUT
    @Path("/{id}")
    public Response createRevision(@PathParam("id") String id, CreateRevisionRequest request,
                                   @HeaderParam(USER_HEADER) String userId) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        VersionBump bump;
        try {
            bump = VersionBump.fromLabel(request.versionType());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("version_type must be one of major, minor, patch");
        }
        RevisionRecord created = revisionService.createRevision(
                id, request.content(), request.changeSummary(), bump, userId);
        return Response.created(URI.create("/documents/" + id + "/content/version/" + created.version()))
                .entity(RevisionResponse.from(created))
                .build();
    }

    @GET
    @Path("/{id}/content")
    public RevisionContentResponse latestContent(@PathParam("id") String id) {
        return RevisionContentResponse.from(revisionService.getContent(id, null));
    }

    @GET
    @Path("/{id}/content/version/{version}")
    public RevisionContentResponse content(@PathParam("id") String id,
                                           @PathParam("version") String version) {
        return RevisionContentResponse.from(revisionService.getContent(id, version));
    }

    @GET
    @Path("/{id}/revisions")
    public DocumentRevisionsResponse revisions(@PathParam("id") String id) {
        List<RevisionResponse> revisions = revisionService.listRevisions(id).stream()
                .map(RevisionResponse::from)
                .toList();
        DocumentResponse document = DocumentResponse.from(revisionService.getDocument(id).document());
        return new DocumentRevisionsResponse(document, revisions);
    }

    @GET
    @Path("/{id}/diff")
    public DiffResult diff(@PathParam("id") String id,
                           @QueryParam("from_version") String fromVersion,
                           @QueryParam("to_version") String toVersion) {
        if (fromVersion == null || toVersion == null) {
            throw new BadRequestException("from_version and to_version are required");
        }
        return revisionService.getDiff(id, fromVersion, toVersion);
    }

    @GET
    @Path("/{id}/nodes")
    public List<NodeDocumentLinkResponse> nodes(@PathParam("id") String id) {
        return linkRegistry.listByDocument(id).stream()
                .map(NodeDocumentLinkResponse::from)
                .toList();
    }
}
