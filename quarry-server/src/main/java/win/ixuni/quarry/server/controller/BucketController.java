package win.ixuni.quarry.server.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.server.service.S3Service;

import java.net.URI;

/**
 * Bucket 操作控制器：创建、删除、存在性检查
 */
@RestController
@RequiredArgsConstructor
public class BucketController {

    private final S3Service s3Service;

    /**
     * Idempotent: creating a bucket that already exists answers 200 as well
     */
    @PutMapping("/{bucket}")
    public Mono<ResponseEntity<Void>> createBucket(@PathVariable String bucket) {
        return s3Service.createBucket(bucket)
                .map(created -> ResponseEntity.ok().location(URI.create("/" + created.getName())).<Void>build());
    }

    @DeleteMapping("/{bucket}")
    public Mono<ResponseEntity<Void>> deleteBucket(@PathVariable String bucket) {
        return s3Service.deleteBucket(bucket)
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    @RequestMapping(value = "/{bucket}", method = RequestMethod.HEAD)
    public Mono<ResponseEntity<Void>> headBucket(@PathVariable String bucket) {
        return s3Service.bucketExists(bucket)
                .map(exists -> ResponseEntity.status(exists ? HttpStatus.OK : HttpStatus.NOT_FOUND).<Void>build());
    }
}
