package ch.so.arp.docqa.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Tuning knobs of the ingestion and question answering pipeline.
 */
@ConfigurationProperties(prefix = "rag")
public class RagProperties {

    /**
     * Use the in-process mocks instead of the OpenAI API.
     */
    private boolean mockOpenai = true;

    /**
     * Keep chunks in memory instead of PostgreSQL.
     */
    private boolean mockVectorStore = true;

    private final Chunking chunking = new Chunking();

    private final Retrieval retrieval = new Retrieval();

    private final Embedding embedding = new Embedding();

    private final Answer answer = new Answer();

    private final Upload upload = new Upload();

    private final Summary summary = new Summary();

    public boolean isMockOpenai() {
        return mockOpenai;
    }

    public void setMockOpenai(boolean mockOpenai) {
        this.mockOpenai = mockOpenai;
    }

    public boolean isMockVectorStore() {
        return mockVectorStore;
    }

    public void setMockVectorStore(boolean mockVectorStore) {
        this.mockVectorStore = mockVectorStore;
    }

    public Chunking getChunking() {
        return chunking;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public Answer getAnswer() {
        return answer;
    }

    public Upload getUpload() {
        return upload;
    }

    public Summary getSummary() {
        return summary;
    }

    public static class Chunking {

        /**
         * Maximum chunk length in characters.
         */
        private int size = 1000;

        /**
         * Characters carried over from the end of one chunk into the next.
         */
        private int overlap = 200;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    public static class Retrieval {

        /**
         * Default number of chunks handed to the answer synthesizer.
         */
        private int topK = 5;

        /**
         * Hits need a cosine similarity strictly greater than this value.
         */
        private double similarityThreshold = 0.7;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }
    }

    public static class Embedding {

        /**
         * Vector size, must match the embedding model and the database column.
         */
        private int dimensions = 1536;

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }
    }

    public static class Answer {

        /**
         * Length of the source excerpts returned with an answer.
         */
        private int excerptLength = 200;

        public int getExcerptLength() {
            return excerptLength;
        }

        public void setExcerptLength(int excerptLength) {
            this.excerptLength = excerptLength;
        }
    }

    public static class Upload {

        private DataSize maxFileSize = DataSize.ofMegabytes(10);

        public DataSize getMaxFileSize() {
            return maxFileSize;
        }

        public void setMaxFileSize(DataSize maxFileSize) {
            this.maxFileSize = maxFileSize;
        }
    }

    public static class Summary {

        /**
         * Size of the text windows summarized individually before the partial
         * summaries are combined.
         */
        private int windowSize = 4000;

        private int windowOverlap = 200;

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public int getWindowOverlap() {
            return windowOverlap;
        }

        public void setWindowOverlap(int windowOverlap) {
            this.windowOverlap = windowOverlap;
        }
    }
}
