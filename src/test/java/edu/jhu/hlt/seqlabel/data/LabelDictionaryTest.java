package edu.jhu.hlt.seqlabel.data;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.io.Writer;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;
import edu.jhu.hlt.seqlabel.inference.CandidatePolicy;
import edu.jhu.hlt.seqlabel.util.FileUtil;

public class LabelDictionaryTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void reservedLabels() {
    LabelDictionary d = LabelDictionary.forTagger(true);
    assertEquals(LabelSpace.PAD, d.lookupIndex(LabelDictionary.PAD));
    assertEquals(LabelSpace.WORD_PIECE, d.lookupIndex(LabelDictionary.WORD_PIECE));
    assertTrue(d.hasWordPiece());
    assertEquals(2, d.lookupIndex("O"));
    assertEquals(3, d.lookupIndex("B-LOC"));
    assertEquals(2, d.lookupIndex("O"));
    assertEquals(4, d.size());
    assertArrayEquals(new int[] {2, 3}, d.labelSpace().realTags());

    LabelDictionary noWp = LabelDictionary.forTagger(false);
    assertFalse(noWp.hasWordPiece());
    assertEquals(1, noWp.lookupIndex("O"));
  }

  @Test
  public void frozenMapsUnknownToPad() {
    LabelDictionary d = LabelDictionary.forTagger(false);
    d.lookupIndex("O");
    d.freeze();
    assertFalse(d.isGrowing());
    assertEquals(LabelSpace.PAD, d.lookupIndex("B-MISC"));
    assertEquals(LabelSpace.PAD, d.lookupIndex("B-MISC"));
    assertEquals(2, d.numOov());
    assertEquals(2, d.size());
    assertFalse(d.contains("B-MISC"));
  }

  @Test
  public void writeAndRead() throws IOException {
    LabelDictionary d = LabelDictionary.forTagger(true);
    for (String l : new String[] {"O", "B-PER", "I-PER"})
      d.lookupIndex(l);
    File f = tmp.newFile("label.dic");
    d.write(f);
    LabelDictionary d2 = LabelDictionary.read(f);
    assertEquals(d.size(), d2.size());
    for (int i = 0; i < d.size(); i++)
      assertEquals(d.lookupLabel(i), d2.lookupLabel(i));
    assertTrue(d2.hasWordPiece());
    assertEquals(d.labelSpace(), d2.labelSpace());
  }

  @Test(expected = IOException.class)
  public void readRequiresPadAtZero() throws IOException {
    File f = tmp.newFile("label.dic");
    try (Writer w = FileUtil.getWriter(f)) {
      w.write("O\t0\n<pad>\t1\n");
    }
    LabelDictionary.read(f);
  }

  @Test(expected = IOException.class)
  public void readRequiresDenseIds() throws IOException {
    File f = tmp.newFile("label.dic");
    try (Writer w = FileUtil.getWriter(f)) {
      w.write("<pad>\t0\nO\t2\n");
    }
    LabelDictionary.read(f);
  }

  @Test
  public void candidatePolicy() {
    LabelDictionary d = LabelDictionary.forTagger(true);
    for (String l : new String[] {"O", "B-PER", "I-PER"})
      d.lookupIndex(l);
    assertTrue(d.candidatePolicy("") instanceof CandidatePolicy.AllRealTags);
    CandidatePolicy p = d.candidatePolicy("I-PER, O");
    assertArrayEquals(new int[] {2, 4}, p.candidates(d.labelSpace(), new int[] {3, 1}, 1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void reservedCandidate() {
    LabelDictionary d = LabelDictionary.forTagger(true);
    d.lookupIndex("O");
    d.candidatePolicy("O,<pad>");
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownCandidate() {
    LabelDictionary d = LabelDictionary.forTagger(true);
    d.lookupIndex("O");
    d.candidatePolicy("B-ORG");
  }
}
