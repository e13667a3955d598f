package io.dwolla.examples.cli.tasks;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import io.dwolla.client.DwollaException;
import io.dwolla.client.http.RestResponse;
import io.dwolla.examples.cli.CommandTask;
import io.dwolla.examples.cli.Task;
import io.dwolla.examples.cli.TaskContext;
import io.dwolla.model.DocumentFile;
import io.dwolla.model.UploadDocumentRequest;
import io.dwolla.util.Utils;

@Task(command = "documents:upload", description = "Upload a verification document for a customer")
public class UploadDocumentTask implements CommandTask {

    private static final String OCTET_STREAM = "application/octet-stream";

    @Override
    public void run(TaskContext context) throws DwollaException {
        String customerId = context.prompt("Customer id");
        String documentType = context.prompt("Document type (passport, license, idCard, other)");
        Path path = Path.of(context.prompt("File path"));

        try (InputStream stream = Files.newInputStream(path)) {
            String contentType = Utils.defaultIfNull(Files.probeContentType(path), OCTET_STREAM);
            UploadDocumentRequest request = new UploadDocumentRequest(documentType,
                    new DocumentFile(contentType, path.getFileName().toString(), stream));

            RestResponse<Void> response = context.client()
                    .upload(context.uri("/customers/" + customerId + "/documents"), request, context.headers());
            context.out().println("Uploaded " + response.location());
        } catch (IOException e) {
            context.out().println("Could not read " + path + ": " + e.getMessage());
        }
    }
}
