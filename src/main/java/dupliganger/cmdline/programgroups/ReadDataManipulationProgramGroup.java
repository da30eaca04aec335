package dupliganger.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that remove or flag duplicate read data in SAM or BAM format
 */
public class ReadDataManipulationProgramGroup implements CommandLineProgramGroup {

    public static final String NAME = "Read Data Manipulation";
    public static final String DESCRIPTION = "Tools that remove or flag PCR duplicates in alignment files using UMIs";

    @Override
    public String getName() { return NAME; }

    @Override
    public String getDescription() { return DESCRIPTION; }
}
