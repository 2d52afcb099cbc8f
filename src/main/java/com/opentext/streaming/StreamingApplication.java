package com.opentext.streaming;

import com.opentext.streaming.model.ChunkRepository;
import com.opentext.streaming.model.Readable;
import com.opentext.streaming.repository.InMemoryChunkSource;
import com.opentext.streaming.service.CompressionService;
import com.opentext.streaming.service.StreamFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;

import java.util.concurrent.TimeUnit;

/**
 * Spring Boot entry point. On startup it run-length encodes a small demo payload into the
 * repository through a pipeline so developers can see the system working end-to-end.
 */
@Slf4j
@SpringBootApplication
public class StreamingApplication {

    static final String DEMO_OBJECT_ID = "demo-object";
    static final String DEMO_PAYLOAD = "AAabBBBCccDDdddDDEEE";

    public static void main(String[] args) throws Exception {
        ApplicationContext context = SpringApplication.run(StreamingApplication.class, args);
        runDemo(context);
    }

    static void runDemo(ApplicationContext context) throws Exception {
        StreamFactory streamFactory = context.getBean(StreamFactory.class);
        CompressionService compressionService = context.getBean(CompressionService.class);
        ChunkRepository repository = context.getBean(ChunkRepository.class);

        // feed the payload in small chunks so runs cross chunk boundaries
        Readable source = streamFactory.readable(InMemoryChunkSource.split(DEMO_PAYLOAD, 4));
        compressionService.process(source, repository.openWritable(DEMO_OBJECT_ID), CompressionService.Operation.COMPRESS)
                .get(30, TimeUnit.SECONDS);
        log.info("Compressed demo payload into {}", DEMO_OBJECT_ID);
    }
}
