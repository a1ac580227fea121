package dev.pekelund.wastelog.analyzer;

import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "waste-log")
public class WasteLogProperties {

    private final Store store = new Store();

    private final Uploads uploads = new Uploads();

    public Store getStore() {
        return store;
    }

    public Uploads getUploads() {
        return uploads;
    }

    public static class Store {

        /**
         * JSON file holding all waste entries and items.
         */
        private Path dataFile = Paths.get("data", "waste.json");

        public Path getDataFile() {
            return dataFile;
        }

        public void setDataFile(Path dataFile) {
            this.dataFile = dataFile;
        }
    }

    public static class Uploads {

        /**
         * Directory that receives the raw uploaded images.
         */
        private Path directory = Paths.get("uploads");

        /**
         * Largest accepted image.
         */
        private DataSize maxSize = DataSize.ofMegabytes(10);

        public Path getDirectory() {
            return directory;
        }

        public void setDirectory(Path directory) {
            this.directory = directory;
        }

        public DataSize getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(DataSize maxSize) {
            this.maxSize = maxSize;
        }
    }
}
