package org.broadinstitute.repeatresolver.sequence;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.reference.ReferenceSequenceFile;
import htsjdk.samtools.reference.ReferenceSequenceFileFactory;
import htsjdk.samtools.util.StringUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.repeatresolver.exceptions.ResolverException;
import org.broadinstitute.repeatresolver.exceptions.UserException;
import org.broadinstitute.repeatresolver.utils.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link SequenceStore} that keeps every sequence in memory.
 * Sequences are added while the store is being populated; after that it is only read, so concurrent lookups need
 * no locking.
 */
public final class InMemorySequenceStore implements SequenceStore {
    private static final Logger logger = LogManager.getLogger(InMemorySequenceStore.class);

    private final Map<SequenceId, byte[]> sequences = new LinkedHashMap<>();

    /**
     * Adds a sequence. Names must be unique within a kind.
     * @return the id under which the sequence can be looked up
     */
    public SequenceId add( final SequenceId id, final byte[] bases ) {
        Utils.nonNull(id, "id");
        Utils.nonNull(bases, "bases");
        if ( sequences.putIfAbsent(id, bases) != null ) {
            throw new UserException.BadInput("duplicate sequence name " + id);
        }
        return id;
    }

    public SequenceId add( final SequenceId id, final String bases ) {
        return add(id, StringUtil.stringToBytes(Utils.nonNull(bases, "bases")));
    }

    /**
     * Loads every record of a FASTA file, registering each under its name (truncated at the first whitespace)
     * with the given kind.
     */
    public static InMemorySequenceStore fromFasta( final Path fastaPath, final SequenceId.Kind kind ) {
        Utils.nonNull(fastaPath, "fastaPath");
        Utils.nonNull(kind, "kind");
        if ( !Files.isReadable(fastaPath) ) {
            throw new UserException.CouldNotReadInputFile(fastaPath, "file does not exist or is not readable");
        }
        final InMemorySequenceStore store = new InMemorySequenceStore();
        try ( final ReferenceSequenceFile fasta = ReferenceSequenceFileFactory.getReferenceSequenceFile(fastaPath) ) {
            ReferenceSequence record;
            while ( (record = fasta.nextSequence()) != null ) {
                store.add(new SequenceId(kind, record.getName()), record.getBases());
            }
        } catch ( final IOException e ) {
            throw new UserException.CouldNotReadInputFile(fastaPath, "error while reading sequences", e);
        } catch ( final SAMException | IllegalArgumentException e ) {
            throw new UserException.MalformedFile(fastaPath, "not a readable fasta file", e);
        }
        logger.info("Loaded " + store.size() + " " + kind.name().toLowerCase() + " sequences from " + fastaPath);
        return store;
    }

    public int size() { return sequences.size(); }

    @Override public boolean contains( final SequenceId id ) {
        return sequences.containsKey(id);
    }

    @Override public byte[] getSequence( final SequenceId id ) {
        final byte[] bases = sequences.get(id);
        if ( bases == null ) {
            throw new ResolverException.ShouldNeverReachHereException("no sequence " + id + " in store");
        }
        return bases;
    }

    @Override public int getLength( final SequenceId id ) {
        return getSequence(id).length;
    }

    @Override public Collection<SequenceId> getIds() {
        return Collections.unmodifiableSet(sequences.keySet());
    }
}
