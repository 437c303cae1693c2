package com.fabtrack.api.file;

import com.fabtrack.api.file.dto.FileBlob;
import com.fabtrack.api.file.dto.FileDeleteResponse;
import com.fabtrack.api.file.dto.ProjectFileDto;
import com.fabtrack.api.file.dto.UploadResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/projects")
public class ProjectFileController {

  private final ProjectFileService service;

  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> upload(@RequestParam String projectNo,
                                               @RequestParam(required = false) String category,
                                               @RequestParam(value = "files", required = false) List<MultipartFile> files) {
    return ResponseEntity.ok(service.upload(projectNo, category, files));
  }

  @GetMapping({"/{projectNo}/files", "/files/{projectNo}"})
  public ResponseEntity<List<ProjectFileDto>> list(@PathVariable String projectNo,
                                                   @RequestParam(required = false) String category) {
    return ResponseEntity.ok(service.list(projectNo, category));
  }

  @GetMapping("/file/blob/{id}")
  public ResponseEntity<byte[]> blob(@PathVariable long id) {
    FileBlob blob = service.blob(id);
    MediaType type;
    try {
      type = blob.mimeType() == null ? MediaType.APPLICATION_OCTET_STREAM : MediaType.parseMediaType(blob.mimeType());
    } catch (InvalidMediaTypeException ex) {
      type = MediaType.APPLICATION_OCTET_STREAM;
    }
    return ResponseEntity.ok()
        .contentType(type)
        .header(HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.inline().filename(blob.fileName(), StandardCharsets.UTF_8).build().toString())
        .body(blob.data());
  }

  @DeleteMapping("/file/{id}")
  public ResponseEntity<FileDeleteResponse> delete(@PathVariable long id) {
    return ResponseEntity.ok(service.delete(id));
  }
}
