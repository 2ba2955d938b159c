import java.io.Closeable;
import java.io.IOException;

public interface RecordSink extends Closeable {

    void accept(DblpRecord record) throws IOException;
}
