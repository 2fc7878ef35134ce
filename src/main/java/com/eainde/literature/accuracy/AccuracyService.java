package com.eainde.literature.accuracy;

import com.eainde.literature.model.Document;
import com.eainde.literature.model.ExtractedRecord;
import com.eainde.literature.model.RecordEdit;
import com.eainde.literature.schema.RecordSchema;
import com.eainde.literature.store.DocumentRepository;
import com.eainde.literature.store.RecordEditRepository;
import com.eainde.literature.store.RecordRepository;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Loads reviewed documents with their records and edits and computes the accuracy report.
 */
@Log4j2
@Service
public class AccuracyService {

    private final DocumentRepository documentRepository;
    private final RecordRepository recordRepository;
    private final RecordEditRepository recordEditRepository;
    private final RecordSchema schema;

    public AccuracyService(DocumentRepository documentRepository,
                           RecordRepository recordRepository,
                           RecordEditRepository recordEditRepository,
                           RecordSchema schema) {
        this.documentRepository = documentRepository;
        this.recordRepository = recordRepository;
        this.recordEditRepository = recordEditRepository;
        this.schema = schema;
    }

    public AccuracyReport calculate() {
        List<Document> reviewed = documentRepository.findReviewed();
        List<ExtractedRecord> records = new ArrayList<>();
        List<RecordEdit> edits = new ArrayList<>();
        for (Document document : reviewed) {
            records.addAll(recordRepository.findByDocument(document.id()));
            edits.addAll(recordEditRepository.findByDocument(document.id()));
        }

        AccuracyReport report = AccuracyCalculator.calculate(reviewed, records, edits, schema);
        log.info("Accuracy over {} reviewed document(s): detection precision {}, recall {}, field F1 {}",
                report.verifiedDocuments(), report.detectionPrecision(), report.detectionRecall(), report.fieldF1());
        return report;
    }
}
