package de.uni_passau.fluxbench.utils;

/**
 * Seedable additive lagged Fibonacci generator, <code>x[n] = x[n-607] + x[n-273] mod 2^64</code>.
 * Seeding, the 63 bit outputs and the bounded draws match the source behind the TSBS query
 * generators bit for bit, so a given seed yields the same hosts, trucks and windows.
 *
 * <p>Instances are not thread-safe. One generator run owns one instance.
 */
public class LaggedFibonacciRandom {

  private static final int LENGTH = 607;
  private static final int TAP = 273;
  private static final long MASK_63 = Long.MAX_VALUE;
  private static final int INT32_MAX = Integer.MAX_VALUE;

  /** Seed used instead of 0, which would leave the seeding sequence stuck. */
  private static final int ZERO_SEED_REPLACEMENT = 89482311;

  /**
   * State after 7.8e12 steps of the generator seeded with 1. Mixed into every seeded state.
   */
  private static final long[] COOKED = {
      -4181792142133755926L, -4576982950128230565L, 1395769623340756751L,
      5333664234075297259L, -6347679516498800754L, 9033628115061424579L,
      7143218595135194537L, 4812947590706362721L, 7937252194349799378L,
      5307299880338848416L, 8209348851763925077L, -7107630437535961764L,
      4593015457530856296L, 8140875735541888011L, -5903942795589686782L,
      -603556388664454774L, -7496297993371156308L, 113108499721038619L,
      4569519971459345583L, -4160538177779461077L, -6835753265595711384L,
      -6507240692498089696L, 6559392774825876886L, 7650093201692370310L,
      7684323884043752161L, -8965504200858744418L, -2629915517445760644L,
      271327514973697897L, -6433985589514657524L, 1065192797246149621L,
      3344507881999356393L, -4763574095074709175L, 7465081662728599889L,
      1014950805555097187L, -4773931307508785033L, -5742262670416273165L,
      2418672789110888383L, 5796562887576294778L, 4484266064449540171L,
      3738982361971787048L, -4699774852342421385L, 10530508058128498L,
      -589538253572429690L, -6598062107225984180L, 8660405965245884302L,
      10162832508971942L, -2682657355892958417L, 7031802312784620857L,
      6240911277345944669L, 831864355460801054L, -1218937899312622917L,
      2116287251661052151L, 2202309800992166967L, 9161020366945053561L,
      4069299552407763864L, 4936383537992622449L, 457351505131524928L,
      -8881176990926596454L, -6375600354038175299L, -7155351920868399290L,
      4368649989588021065L, 887231587095185257L, -3659780529968199312L,
      -2407146836602825512L, 5616972787034086048L, -751562733459939242L,
      1686575021641186857L, -5177887698780513806L, -4979215821652996885L,
      -1375154703071198421L, 5632136521049761902L, -8390088894796940536L,
      -193645528485698615L, -5979788902190688516L, -4907000935050298721L,
      -285522056888777828L, -2776431630044341707L, 1679342092332374735L,
      6050638460742422078L, -2229851317345194226L, -1582494184340482199L,
      5881353426285907985L, 812786550756860885L, 4541845584483343330L,
      -6497901820577766722L, 4980675660146853729L, -4012602956251539747L,
      -329088717864244987L, -2896929232104691526L, 1495812843684243920L,
      -2153620458055647789L, 7370257291860230865L, -2466442761497833547L,
      4706794511633873654L, -1398851569026877145L, 8549875090542453214L,
      -9189721207376179652L, -7894453601103453165L, 7297902601803624459L,
      1011190183918857495L, -6985347000036920864L, 5147159997473910359L,
      -8326859945294252826L, 2659470849286379941L, 6097729358393448602L,
      -7491646050550022124L, -5117116194870963097L, -896216826133240300L,
      -745860416168701406L, 5803876044675762232L, -787954255994554146L,
      -3234519180203704564L, -4507534739750823898L, -1657200065590290694L,
      505808562678895611L, -4153273856159712438L, -8381261370078904295L,
      572156825025677802L, 1791881013492340891L, 3393267094866038768L,
      -5444650186382539299L, 2352769483186201278L, -7930912453007408350L,
      -325464993179687389L, -3441562999710612272L, -6489413242825283295L,
      5092019688680754699L, -227247482082248967L, 4234737173186232084L,
      5027558287275472836L, 4635198586344772304L, -536033143587636457L,
      5907508150730407386L, -8438615781380831356L, 972392927514829904L,
      -3801314342046600696L, -4064951393885491917L, -174840358296132583L,
      2407211146698877100L, -1640089820333676239L, 3940796514530962282L,
      -5882197405809569433L, 3095313889586102949L, -1818050141166537098L,
      5832080132947175283L, 7890064875145919662L, 8184139210799583195L,
      -8073512175445549678L, -7758774793014564506L, -4581724029666783935L,
      3516491885471466898L, -8267083515063118116L, 6657089965014657519L,
      5220884358887979358L, 1796677326474620641L, 5340761970648932916L,
      1147977171614181568L, 5066037465548252321L, 2574765911837859848L,
      1085848279845204775L, -5873264506986385449L, 6116438694366558490L,
      2107701075971293812L, -7420077970933506541L, 2469478054175558874L,
      -1855128755834809824L, -5431463669011098282L, -9038325065738319171L,
      -6966276280341336160L, 7217693971077460129L, -8314322083775271549L,
      7196649268545224266L, -3585711691453906209L, -5267827091426810625L,
      8057528650917418961L, -5084103596553648165L, -2601445448341207749L,
      -7850010900052094367L, 6527366231383600011L, 3507654575162700890L,
      9202058512774729859L, 1954818376891585542L, -2582991129724600103L,
      8299563319178235687L, -5321504681635821435L, 7046310742295574065L,
      -2376176645520785576L, -7650733936335907755L, 8850422670118399721L,
      3631909142291992901L, 5158881091950831288L, -6340413719511654215L,
      4763258931815816403L, 6280052734341785344L, -4979582628649810958L,
      2043464728020827976L, -2678071570832690343L, 4562580375758598164L,
      5495451168795427352L, -7485059175264624713L, 553004618757816492L,
      6895160632757959823L, -989748114590090637L, 7139506338801360852L,
      -672480814466784139L, 5535668688139305547L, 2430933853350256242L,
      -3821430778991574732L, -1063731997747047009L, -3065878205254005442L,
      7632066283658143750L, 6308328381617103346L, 3681878764086140361L,
      3289686137190109749L, 6587997200611086848L, 244714774258135476L,
      -5143583659437639708L, 8090302575944624335L, 2945117363431356361L,
      -8359047641006034763L, 3009039260312620700L, -793344576772241777L,
      401084700045993341L, -1968749590416080887L, 4707864159563588614L,
      -3583123505891281857L, -3240864324164777915L, -5908273794572565703L,
      -3719524458082857382L, -5281400669679581926L, 8118566580304798074L,
      3839261274019871296L, 7062410411742090847L, -8481991033874568140L,
      6027994129690250817L, -6725542042704711878L, -2971981702428546974L,
      -7854441788951256975L, 8809096399316380241L, 6492004350391900708L,
      2462145737463489636L, -8818543617934476634L, -5070345602623085213L,
      -8961586321599299868L, -3758656652254704451L, -8630661632476012791L,
      6764129236657751224L, -709716318315418359L, -3403028373052861600L,
      -8838073512170985897L, -3999237033416576341L, -2920240395515973663L,
      -2073249475545404416L, 368107899140673753L, -6108185202296464250L,
      -6307735683270494757L, 4782583894627718279L, 6718292300699989587L,
      8387085186914375220L, 3387513132024756289L, 4654329375432538231L,
      -292704475491394206L, -3848998599978456535L, 7623042350483453954L,
      7725442901813263321L, 9186225467561587250L, -5132344747257272453L,
      -6865740430362196008L, 2530936820058611833L, 1636551876240043639L,
      -3658707362519810009L, 1452244145334316253L, -7161729655835084979L,
      -7943791770359481772L, 9108481583171221009L, -3200093350120725999L,
      5007630032676973346L, 2153168792952589781L, 6720334534964750538L,
      -3181825545719981703L, 3433922409283786309L, 2285479922797300912L,
      3110614940896576130L, -2856812446131932915L, -3804580617188639299L,
      7163298419643543757L, 4891138053923696990L, 580618510277907015L,
      1684034065251686769L, 4429514767357295841L, -8893025458299325803L,
      -8103734041042601133L, 7177515271653460134L, 4589042248470800257L,
      -1530083407795771245L, 143607045258444228L, 246994305896273627L,
      -8356954712051676521L, 6473547110565816071L, 3092379936208876896L,
      2058427839513754051L, -4089587328327907870L, 8785882556301281247L,
      -3074039370013608197L, -637529855400303673L, 6137678347805511274L,
      -7152924852417805802L, 5708223427705576541L, -3223714144396531304L,
      4358391411789012426L, 325123008708389849L, 6837621693887290924L,
      4843721905315627004L, -3212720814705499393L, -3825019837890901156L,
      4602025990114250980L, 1044646352569048800L, 9106614159853161675L,
      -8394115921626182539L, -4304087667751778808L, 2681532557646850893L,
      3681559472488511871L, -3915372517896561773L, -2889241648411946534L,
      -6564663803938238204L, -8060058171802589521L, 581945337509520675L,
      3648778920718647903L, -4799698790548231394L, -7602572252857820065L,
      220828013409515943L, -1072987336855386047L, 4287360518296753003L,
      -4633371852008891965L, 5513660857261085186L, -2258542936462001533L,
      -8744380348503999773L, 8746140185685648781L, 228500091334420247L,
      1356187007457302238L, 3019253992034194581L, 3152601605678500003L,
      -8793219284148773595L, 5559581553696971176L, 4916432985369275664L,
      -8559797105120221417L, -5802598197927043732L, 2868348622579915573L,
      -7224052902810357288L, -5894682518218493085L, 2587672709781371173L,
      -7706116723325376475L, 3092343956317362483L, -5561119517847711700L,
      972445599196498113L, -1558506600978816441L, 1708913533482282562L,
      -2305554874185907314L, -6005743014309462908L, -6653329009633068701L,
      -483583197311151195L, 2488075924621352812L, -4529369641467339140L,
      -4663743555056261452L, 2997203966153298104L, 1282559373026354493L,
      240113143146674385L, 8665713329246516443L, 628141331766346752L,
      -4651421219668005332L, -7750560848702540400L, 7596648026010355826L,
      -3132152619100351065L, 7834161864828164065L, 7103445518877254909L,
      4390861237357459201L, -4780718172614204074L, -319889632007444440L,
      622261699494173647L, -3186110786557562560L, -8718967088789066690L,
      -1948156510637662747L, -8212195255998774408L, -7028621931231314745L,
      2623071828615234808L, -4066058308780939700L, -5484966924888173764L,
      -6683604512778046238L, -6756087640505506466L, 5256026990536851868L,
      7841086888628396109L, 6640857538655893162L, -8021284697816458310L,
      -7109857044414059830L, -1689021141511844405L, -4298087301956291063L,
      -4077748265377282003L, -998231156719803476L, 2719520354384050532L,
      9132346697815513771L, 4332154495710163773L, -2085582442760428892L,
      6994721091344268833L, -2556143461985726874L, -8567931991128098309L,
      59934747298466858L, -3098398008776739403L, -265597256199410390L,
      2332206071942466437L, -7522315324568406181L, 3154897383618636503L,
      -7585605855467168281L, -6762850759087199275L, 197309393502684135L,
      -8579694182469508493L, 2543179307861934850L, 4350769010207485119L,
      -4468719947444108136L, -7207776534213261296L, -1224312577878317200L,
      4287946071480840813L, 8362686366770308971L, 6486469209321732151L,
      -5605644191012979782L, -1669018511020473564L, 4450022655153542367L,
      -7618176296641240059L, -3896357471549267421L, -4596796223304447488L,
      -6531150016257070659L, -8982326463137525940L, -4125325062227681798L,
      -1306489741394045544L, -8338554946557245229L, 5329160409530630596L,
      7790979528857726136L, 4955070238059373407L, -4304834761432101506L,
      -6215295852904371179L, 3007769226071157901L, -6753025801236972788L,
      8928702772696731736L, 7856187920214445904L, -4748497451462800923L,
      7900176660600710914L, -7082800908938549136L, -6797926979589575837L,
      -6737316883512927978L, 4186670094382025798L, 1883939007446035042L,
      -414705992779907823L, 3734134241178479257L, 4065968871360089196L,
      6953124200385847784L, -7917685222115876751L, -7585632937840318161L,
      -5567246375906782599L, -5256612402221608788L, 3106378204088556331L,
      -2894472214076325998L, 4565385105440252958L, 1979884289539493806L,
      -6891578849933910383L, 3783206694208922581L, 8464961209802336085L,
      2843963751609577687L, 3030678195484896323L, -4429654462759003204L,
      4459239494808162889L, 402587895800087237L, 8057891408711167515L,
      4541888170938985079L, 1042662272908816815L, -3666068979732206850L,
      2647678726283249984L, 2144477441549833761L, -3417019821499388721L,
      -2105601033380872185L, 5916597177708541638L, -8760774321402454447L,
      8833658097025758785L, 5970273481425315300L, 563813119381731307L,
      -6455022486202078793L, 1598828206250873866L, -4016978389451217698L,
      -2988328551145513985L, -6071154634840136312L, 8469693267274066490L,
      125672920241807416L, -3912292412830714870L, -2559617104544284221L,
      -486523741806024092L, -4735332261862713930L, 5923302823487327109L,
      -9082480245771672572L, -1808429243461201518L, 7990420780896957397L,
      4317817392807076702L, 3625184369705367340L, -6482649271566653105L,
      -3480272027152017464L, -3225473396345736649L, -368878695502291645L,
      -3981164001421868007L, -8522033136963788610L, 7609280429197514109L,
      3020985755112334161L, -2572049329799262942L, 2635195723621160615L,
      5144520864246028816L, -8188285521126945980L, 1567242097116389047L,
      8172389260191636581L, -2885551685425483535L, -7060359469858316883L,
      -6480181133964513127L, -7317004403633452381L, 6011544915663598137L,
      5932255307352610768L, 2241128460406315459L, -8327867140638080220L,
      3094483003111372717L, 4583857460292963101L, 9079887171656594975L,
      -384082854924064405L, -3460631649611717935L, 4225072055348026230L,
      -7385151438465742745L, 3801620336801580414L, -399845416774701952L,
      -7446754431269675473L, 7899055018877642622L, 5421679761463003041L,
      5521102963086275121L, -4975092593295409910L, 8735487530905098534L,
      -7462844945281082830L, -2080886987197029914L, -1000715163927557685L,
      -4253840471931071485L, -5828896094657903328L, 6424174453260338141L,
      359248545074932887L, -5949720754023045210L, -2426265837057637212L,
      3030918217665093212L, -9077771202237461772L, -3186796180789149575L,
      740416251634527158L, -2142944401404840226L, 6951781370868335478L,
      399922722363687927L, -8928469722407522623L, -1378421100515597285L,
      -8343051178220066766L, -3030716356046100229L, -8811767350470065420L,
      9026808440365124461L, 6440783557497587732L, 4615674634722404292L,
      539897290441580544L, 2096238225866883852L, 8751955639408182687L,
      -7316147128802486205L, 7381039757301768559L, 6157238513393239656L,
      -1473377804940618233L, 8629571604380892756L, 5280433031239081479L,
      7101611890139813254L, 2479018537985767835L, 7169176924412769570L,
      -1281305539061572506L, -7865612307799218120L, 2278447439451174845L,
      3625338785743880657L, 6477479539006708521L, 8976185375579272206L,
      -3712000482142939688L, 1326024180520890843L, 7537449876596048829L,
      5464680203499696154L, 3189671183162196045L, 6346751753565857109L,
      -8982212049534145501L, -6127578587196093755L, -245039190118465649L,
      -6320577374581628592L, 7208698530190629697L, 7276901792339343736L,
      -7490986807540332668L, 4133292154170828382L, 2918308698224194548L,
      -7703910638917631350L, -3929437324238184044L, -4300543082831323144L,
      -6344160503358350167L, 5896236396443472108L, -758328221503023383L,
      -1894351639983151068L, -307900319840287220L, -6278469401177312761L,
      -2171292963361310674L, 8382142935188824023L, 9103922860780351547L,
      4152330101494654406L
  };

  private final long[] vec = new long[LENGTH];
  private int tap;
  private int feed;

  /**
   * Creates a generator.
   *
   * @param seed Seed, only its residue modulo 2^31 - 1 matters.
   */
  public LaggedFibonacciRandom(long seed) {
    setSeed(seed);
  }

  /**
   * Resets the generator to the state derived from <code>seed</code>.
   *
   * @param seed Seed.
   */
  public void setSeed(long seed) {
    tap = 0;
    feed = LENGTH - TAP;

    seed = seed % INT32_MAX;
    if (seed < 0) {
      seed += INT32_MAX;
    }
    if (seed == 0) {
      seed = ZERO_SEED_REPLACEMENT;
    }

    int x = (int) seed;
    for (int i = -20; i < LENGTH; i++) {
      x = seedStep(x);
      if (i >= 0) {
        long u = (long) x << 40;
        x = seedStep(x);
        u ^= (long) x << 20;
        x = seedStep(x);
        u ^= x;
        u ^= COOKED[i];
        vec[i] = u;
      }
    }
  }

  /** Park-Miller step <code>x * 48271 mod (2^31 - 1)</code> without overflow. */
  private static int seedStep(int x) {
    final int a = 48271;
    final int q = 44488;
    final int r = 3399;
    int hi = x / q;
    int lo = x % q;
    x = a * lo - r * hi;
    if (x < 0) {
      x += INT32_MAX;
    }
    return x;
  }

  /**
   * Advances the generator.
   *
   * @return 64 random bits.
   */
  public long nextBits() {
    tap--;
    if (tap < 0) {
      tap += LENGTH;
    }
    feed--;
    if (feed < 0) {
      feed += LENGTH;
    }
    long x = vec[feed] + vec[tap];
    vec[feed] = x;
    return x;
  }

  /**
   * Returns a non-negative long.
   *
   * @return Value in <code>[0, 2^63)</code>.
   */
  public long nextLong() {
    return nextBits() & MASK_63;
  }

  /**
   * Returns a non-negative int taken from the high bits of {@link #nextLong()}.
   *
   * @return Value in <code>[0, 2^31)</code>.
   */
  public int nextInt() {
    return (int) (nextLong() >>> 32);
  }

  /**
   * Returns a uniformly distributed long in <code>[0, bound)</code>. Values from the biased top
   * slice of the 63 bit range are redrawn.
   *
   * @param bound Exclusive upper bound, must be positive.
   * @return Random value.
   */
  public long nextLong(long bound) {
    if (bound <= 0) {
      throw new IllegalArgumentException("invalid argument to nextLong: " + bound);
    }
    if ((bound & (bound - 1)) == 0) {
      return nextLong() & (bound - 1);
    }
    long max = MASK_63 - Long.remainderUnsigned(Long.MIN_VALUE, bound);
    long v = nextLong();
    while (v > max) {
      v = nextLong();
    }
    return v % bound;
  }

  /**
   * Returns a uniformly distributed int in <code>[0, bound)</code>. Values from the biased top
   * slice of the 31 bit range are redrawn.
   *
   * @param bound Exclusive upper bound, must be positive.
   * @return Random value.
   */
  public int nextInt(int bound) {
    if (bound <= 0) {
      throw new IllegalArgumentException("invalid argument to nextInt: " + bound);
    }
    if ((bound & (bound - 1)) == 0) {
      return nextInt() & (bound - 1);
    }
    int max = (int) (INT32_MAX - (1L << 31) % bound);
    int v = nextInt();
    while (v > max) {
      v = nextInt();
    }
    return v % bound;
  }
}
