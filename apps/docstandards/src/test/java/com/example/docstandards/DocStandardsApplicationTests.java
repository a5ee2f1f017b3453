package com.example.docstandards;

import com.example.docstandards.blob.BlobStore;
import com.example.docstandards.blob.InMemoryBlobStore;
import com.example.docstandards.validation.store.InMemoryValidationJobStore;
import com.example.docstandards.validation.store.ValidationJobStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class DocStandardsApplicationTests {

    @Autowired
    private BlobStore blobStore;

    @Autowired
    private ValidationJobStore jobStore;

    @Test
    void contextLoads() {
        // memory stores selected by the test profile
        assertThat(blobStore).isInstanceOf(InMemoryBlobStore.class);
        assertThat(jobStore).isInstanceOf(InMemoryValidationJobStore.class);
    }
}
