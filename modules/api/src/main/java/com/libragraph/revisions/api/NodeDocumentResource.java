package com.libragraph.revisions.api;

import com.libragraph.revisions.api.model.LinkDocumentRequest;
import com.libragraph.revisions.api.model.NodeDocumentLinkResponse;
import com.libragraph.revisions.api.model.NodeDocumentsResponse;
import com.libragraph.revisions.core.dao.NodeDocumentLinkRecord;
import com.libragraph.revisions.core.error.ValidationException;
import com.libragraph.revisions.core.link.NodeDocumentLinkRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path("/nodes/{nodeId}/documents")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class NodeDocumentResource {

    @Inject
    NodeDocumentLinkRegistry linkRegistry;

    @GET
    public NodeDocumentsResponse list(@PathParam("nodeId") String nodeId) {
        return new NodeDocumentsResponse(nodeId, linkRegistry.listByNode(nodeId).stream()
                .map(NodeDocumentLinkResponse::from)
                .toList());
    }

    @POST
    public Response link(@PathParam("nodeId") String nodeId, LinkDocumentRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        NodeDocumentLinkRecord link = linkRegistry.link(
                nodeId, request.documentId(), request.relationType(), request.orderPosition());
        return Response.status(Response.Status.CREATED)
                .entity(NodeDocumentLinkResponse.from(link))
                .build();
    }

    @DELETE
    @Path("/{documentId}")
    public Response unlink(@PathParam("nodeId") String nodeId,
                           @PathParam("documentId") String documentId) {
        linkRegistry.unlink(nodeId, documentId);
        return Response.noContent().build();
    }

    @DELETE
    public Response unlinkByQuery(@PathParam("nodeId") String nodeId,
                                  @QueryParam("document_id") String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new BadRequestException("document_id is required");
        }
        linkRegistry.unlink(nodeId, documentId);
        return Response.noContent().build();
    }
}
