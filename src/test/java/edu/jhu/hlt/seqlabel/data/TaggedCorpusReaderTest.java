package edu.jhu.hlt.seqlabel.data;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;
import edu.jhu.hlt.seqlabel.datatypes.Sequence;
import edu.jhu.hlt.seqlabel.util.FileUtil;

public class TaggedCorpusReaderTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private File write(String name, String contents) throws IOException {
    File f = tmp.newFile(name);
    try (Writer w = FileUtil.getWriter(f)) {
      w.write(contents);
    }
    return f;
  }

  @Test
  public void read() throws IOException {
    File f = write("train.txt",
        "B-PER\tJohn\t1 0 0.5\n"
        + "I-PER\tSmith\t0 1 -0.5\n"
        + "\n\n"
        + "O\tran\t0 0  1\n"
        + "-word-piece-\t##s\t1e-3 0 0");
    LabelDictionary labels = LabelDictionary.forTagger(true);
    TaggedCorpusReader r = new TaggedCorpusReader(labels);
    List<Sequence> data = r.read(f);
    assertEquals(2, data.size());
    assertEquals(3, r.getFeatureDimension());

    Sequence a = data.get(0);
    assertEquals(2, a.length());
    assertEquals("Smith", a.getWord(1));
    assertArrayEquals(new int[] {2, 3}, a.getLabels());
    assertArrayEquals(new double[] {0, 1, -0.5}, a.getFeatures()[1], 0d);

    Sequence b = data.get(1);
    assertArrayEquals(new int[] {4, LabelSpace.WORD_PIECE}, b.getLabels());
    assertArrayEquals(new double[] {0, 0, 1}, b.getFeatures()[0], 0d);
    assertEquals(5, labels.size());
  }

  @Test
  public void frozenLabels() throws IOException {
    LabelDictionary labels = LabelDictionary.forTagger(false);
    labels.lookupIndex("O");
    labels.freeze();
    File f = write("test.txt", "O\ta\t1\nB-ORG\tb\t2\n\n");
    List<Sequence> data = new TaggedCorpusReader(labels).read(f);
    assertArrayEquals(new int[] {1, LabelSpace.PAD}, data.get(0).getLabels());
    assertEquals(2, labels.size());
  }

  @Test
  public void gzip() throws IOException {
    File f = new File(tmp.getRoot(), "train.txt.gz");
    try (Writer w = FileUtil.getWriter(f)) {
      w.write("O\ta\t1 2\n");
    }
    List<Sequence> data = new TaggedCorpusReader(LabelDictionary.forTagger(false)).read(f);
    assertEquals(1, data.size());
    assertEquals(2, data.get(0).featureDimension());
  }

  @Test(expected = IOException.class)
  public void featureWidthMustNotChange() throws IOException {
    File f = write("bad.txt", "O\ta\t1 2\n\nO\tb\t1 2 3\n");
    new TaggedCorpusReader(LabelDictionary.forTagger(false)).read(f);
  }

  @Test(expected = IOException.class)
  public void featureWidthIsSharedAcrossFiles() throws IOException {
    TaggedCorpusReader r = new TaggedCorpusReader(LabelDictionary.forTagger(false));
    r.read(write("a.txt", "O\ta\t1 2\n"));
    r.read(write("b.txt", "O\ta\t1\n"));
  }

  @Test(expected = IOException.class)
  public void missingColumn() throws IOException {
    File f = write("bad.txt", "O\ta\n");
    new TaggedCorpusReader(LabelDictionary.forTagger(false)).read(f);
  }

  @Test(expected = IOException.class)
  public void badNumber() throws IOException {
    File f = write("bad.txt", "O\ta\t1 two\n");
    new TaggedCorpusReader(LabelDictionary.forTagger(false)).read(f);
  }
}
